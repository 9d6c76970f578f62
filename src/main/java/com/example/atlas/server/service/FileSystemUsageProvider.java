package com.example.atlas.server.service;

import com.example.atlas.server.dto.DiskUsage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 파일시스템(볼륨) 단위 사용량.
 * <p>
 * 경로가 속한 볼륨의 FileStore 통계를 그대로 보고합니다.
 * free = 사용 가능 공간, used = 전체 공간 - free.
 * </p>
 */
@Slf4j
public class FileSystemUsageProvider implements UsageProvider {

    @Override
    public DiskUsage getUsage(Path path) throws IOException {
        FileStore store = Files.getFileStore(path);
        long free = store.getUsableSpace();
        long total = store.getTotalSpace();
        long used = Math.max(total - free, 0);

        log.debug("=== [USAGE] 파일시스템 {} free={}, used={} ===", store.name(), free, used);
        return new DiskUsage(free, used);
    }
}

package com.example.atlas.server.service;

import com.example.atlas.server.dto.DiskUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 쿼터 기반 사용량.
 * <p>
 * 호스트 디스크 대신 공유 디렉토리 사용량을 쿼터 크기에 맞춰 보고합니다.
 * used = min(디렉토리 사용량, 쿼터), free = 쿼터 - used (음수가 되지 않음).
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class QuotaUsageProvider implements UsageProvider {

    private final DirectoryUsageProvider directoryUsageProvider;
    private final long quotaBytes;

    @Override
    public DiskUsage getUsage(Path path) throws IOException {
        long dirUsed = directoryUsageProvider.getUsedBytes(path);
        long used = Math.min(dirUsed, quotaBytes);
        long free = quotaBytes - used;

        if (dirUsed > quotaBytes) {
            log.debug("=== [USAGE] 쿼터 초과 사용량 {} → {} 로 보고 ===", dirUsed, quotaBytes);
        }
        return new DiskUsage(free, used);
    }

    public long getQuotaBytes() {
        return quotaBytes;
    }
}

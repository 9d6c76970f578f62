package com.example.atlas.server.service;

import com.example.atlas.server.dto.DiskUsage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 쿼터 보고에 사용할 여유/사용 바이트 수를 계산합니다.
 */
public interface UsageProvider {

    /**
     * @param path 데이터 디렉토리 절대 경로
     * @return 여유/사용 바이트 수
     * @throws IOException 경로 자체에 접근할 수 없는 경우
     */
    DiskUsage getUsage(Path path) throws IOException;
}

package com.example.atlas.server.dto;

import lombok.Value;

/**
 * 쿼터 보고용 디스크 사용량 (바이트)
 */
@Value
public class DiskUsage {

    /** 사용 가능한 바이트 수 (quota-available-bytes) */
    long freeBytes;

    /** 사용 중인 바이트 수 (quota-used-bytes) */
    long usedBytes;
}

package com.example.atlas.server.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * 쿼터 보고 설정.
 * <p>
 * 크기가 지정되면 클라이언트에게 이 크기의 드라이브로 보고합니다
 * (used = 데이터 디렉토리 사용량, available = 쿼터 - used).
 * 0이면 데이터 디렉토리가 속한 파일시스템의 여유/사용 공간을 그대로 보고합니다.
 * </p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "atlas.quota")
public class QuotaProperties {

    /** 보고할 쿼터 크기 (예: 2G, 512MB). 기본값 0B → 쿼터 미설정, 변환은 {@link QuotaSizeConverter} */
    private DataSize size = DataSize.ofBytes(0);

    /** 쿼터 설정 여부 */
    public boolean isEnabled() {
        return size != null && size.toBytes() > 0;
    }

    /** 쿼터 크기 (바이트) */
    public long getQuotaBytes() {
        return size == null ? 0 : Math.max(size.toBytes(), 0);
    }
}

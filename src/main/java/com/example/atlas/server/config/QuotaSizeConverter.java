package com.example.atlas.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.convert.converter.Converter;
import org.springframework.util.unit.DataSize;

import java.util.Locale;

/**
 * 쿼터 크기 문자열 변환기.
 * <p>
 * "2G", "512M", "1K" 같은 단일 문자 단위와 "2GB", "512MB" 표기, 단위 없는 바이트 수를 모두 받습니다.
 * 단위는 1024 배수입니다. 해석할 수 없는 값은 경고를 남기고 0(쿼터 미설정)으로 처리합니다.
 * </p>
 */
@Slf4j
public class QuotaSizeConverter implements Converter<String, DataSize> {

    @Override
    public DataSize convert(String source) {
        String value = source.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            return DataSize.ofBytes(0);
        }

        if (value.endsWith("B")) {
            value = value.substring(0, value.length() - 1);
        }

        long multiplier = 1;
        if (value.endsWith("K")) {
            multiplier = 1L << 10;
        } else if (value.endsWith("M")) {
            multiplier = 1L << 20;
        } else if (value.endsWith("G")) {
            multiplier = 1L << 30;
        } else if (value.endsWith("T")) {
            multiplier = 1L << 40;
        }
        if (multiplier > 1) {
            value = value.substring(0, value.length() - 1);
        }

        try {
            long amount = Long.parseLong(value.trim());
            if (amount < 0) {
                throw new NumberFormatException("negative");
            }
            return DataSize.ofBytes(Math.multiplyExact(amount, multiplier));
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("=== [ATLAS CONFIG] 쿼터 크기를 해석할 수 없어 쿼터를 사용하지 않습니다: '{}' ===", source);
            return DataSize.ofBytes(0);
        }
    }
}

package com.example.atlas.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaSizeConverterTest {

    private final QuotaSizeConverter converter = new QuotaSizeConverter();

    @Test
    @DisplayName("단일 문자 단위를 1024 배수로 해석한다")
    void parsesShortUnits() {
        assertThat(converter.convert("2G").toBytes()).isEqualTo(2L << 30);
        assertThat(converter.convert("512M").toBytes()).isEqualTo(512L << 20);
        assertThat(converter.convert("1k").toBytes()).isEqualTo(1024);
    }

    @Test
    @DisplayName("B가 붙은 표기와 단위 없는 숫자도 받는다")
    void parsesLongUnitsAndPlainBytes() {
        assertThat(converter.convert("2GB").toBytes()).isEqualTo(2L << 30);
        assertThat(converter.convert(" 1mb ").toBytes()).isEqualTo(1L << 20);
        assertThat(converter.convert("0B").toBytes()).isZero();
        assertThat(converter.convert("4096").toBytes()).isEqualTo(4096);
    }

    @Test
    @DisplayName("해석할 수 없는 값은 0(쿼터 미설정)으로 처리한다")
    void invalidValuesDisableQuota() {
        assertThat(converter.convert("").toBytes()).isZero();
        assertThat(converter.convert("lots").toBytes()).isZero();
        assertThat(converter.convert("-5G").toBytes()).isZero();
        assertThat(converter.convert("1.5G").toBytes()).isZero();
        assertThat(converter.convert("99999999999T").toBytes()).isZero();
    }

    @Test
    @DisplayName("atlas.quota.size 바인딩에 단일 문자 단위를 사용할 수 있다")
    void bindsShortUnitThroughProperties() {
        new ApplicationContextRunner()
                .withUserConfiguration(QuotaBindingConfig.class)
                .withPropertyValues("atlas.quota.size=512M")
                .run(context -> {
                    QuotaProperties properties = context.getBean(QuotaProperties.class);
                    assertThat(properties.isEnabled()).isTrue();
                    assertThat(properties.getQuotaBytes()).isEqualTo(512L << 20);
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(QuotaProperties.class)
    static class QuotaBindingConfig {

        @Bean
        @ConfigurationPropertiesBinding
        static QuotaSizeConverter quotaSizeConverter() {
            return new QuotaSizeConverter();
        }
    }
}

package com.example.atlas.server.config;

import com.example.atlas.server.filter.BasicAuthFilter;
import com.example.atlas.server.filter.ContentTypeHintFilter;
import com.example.atlas.server.filter.QuotaReportFilter;
import com.example.atlas.server.filter.WebDavErrorLogFilter;
import com.example.atlas.server.service.DirectoryUsageProvider;
import com.example.atlas.server.service.FileSystemUsageProvider;
import com.example.atlas.server.service.QuotaPropertyInjector;
import com.example.atlas.server.service.QuotaUsageProvider;
import com.example.atlas.server.service.UsageProvider;
import com.example.atlas.server.store.UserStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.catalina.servlets.WebdavServlet;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * WebDAV 서버 핵심 빈 설정.
 * <p>
 * Tomcat 내장 {@link WebdavServlet}을 WebDAV 프로토콜 엔진으로 사용합니다.
 * 이 서블릿이 PROPFIND, GET, PUT, MKCOL, DELETE, COPY, MOVE, LOCK, UNLOCK을 모두 처리하며,
 * 데이터 디렉토리를 Tomcat document root로 지정해 파일을 직접 읽고 씁니다.
 * </p>
 *
 * <h3>필터 체인 (순서 고정):</h3>
 * <ol>
 *   <li>BasicAuthFilter (order 1) - 인증 실패 시 체인 중단</li>
 *   <li>ContentTypeHintFilter (order 2)</li>
 *   <li>QuotaReportFilter (order 3) - PROPFIND / 응답 재작성</li>
 *   <li>WebDavErrorLogFilter (order 4) - 엔진 오류 응답 로깅</li>
 * </ol>
 * <p>
 * 필터는 Bean으로 직접 생성하고 FilterRegistrationBean에서만 등록합니다 (이중 등록 방지).
 * </p>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebDavServerConfig {

    private final AtlasServerProperties atlasServerProperties;
    private final QuotaProperties quotaProperties;

    /**
     * "2G", "512M" 같은 단위 표기를 쿼터 크기로 변환합니다.
     * 프로퍼티 바인딩 시점에 필요하므로 static으로 선언합니다.
     */
    @Bean
    @ConfigurationPropertiesBinding
    public static QuotaSizeConverter quotaSizeConverter() {
        return new QuotaSizeConverter();
    }

    /**
     * 사용자 저장소 빈.
     * 서버 시작 시 한 번 로드하며, 서버 프로세스는 이후 인증 조회만 수행합니다.
     */
    @Bean
    public UserStore userStore(ObjectMapper objectMapper) throws IOException {
        UserStore store = new UserStore(Paths.get(atlasServerProperties.getUsersFile()), objectMapper);
        store.load();

        if (store.size() == 0) {
            log.warn("=== [ATLAS CONFIG] 등록된 사용자가 없습니다. 모든 접속이 거부됩니다: {} ===",
                    store.getFilePath().toAbsolutePath());
        }
        return store;
    }

    /**
     * 쿼터 설정에 따라 사용량 계산 방식을 선택합니다.
     * <ul>
     *   <li>쿼터 > 0: 데이터 디렉토리 사용량을 쿼터 크기에 맞춰 보고</li>
     *   <li>쿼터 = 0: 데이터 디렉토리가 속한 파일시스템 통계를 그대로 보고</li>
     * </ul>
     */
    @Bean
    public UsageProvider usageProvider() {
        if (quotaProperties.isEnabled()) {
            long quotaBytes = quotaProperties.getQuotaBytes();
            log.info("=== [ATLAS CONFIG] 쿼터: {} bytes ({} GB), 클라이언트에 이 크기로 보고 ===",
                    quotaBytes, String.format("%.2f", quotaBytes / (double) (1L << 30)));
            return new QuotaUsageProvider(new DirectoryUsageProvider(), quotaBytes);
        }
        log.info("=== [ATLAS CONFIG] 쿼터 미설정, 파일시스템 사용량 보고 ===");
        return new FileSystemUsageProvider();
    }

    @Bean
    public QuotaPropertyInjector quotaPropertyInjector() {
        return new QuotaPropertyInjector();
    }

    @Bean
    public BasicAuthFilter basicAuthFilter(UserStore userStore) {
        return new BasicAuthFilter(userStore, atlasServerProperties.getRealm());
    }

    @Bean
    public ContentTypeHintFilter contentTypeHintFilter() {
        return new ContentTypeHintFilter();
    }

    @Bean
    public QuotaReportFilter quotaReportFilter(UsageProvider usageProvider,
                                              QuotaPropertyInjector quotaPropertyInjector) {
        return new QuotaReportFilter(usageProvider, quotaPropertyInjector,
                atlasServerProperties.getDataRoot());
    }

    @Bean
    public WebDavErrorLogFilter webDavErrorLogFilter() {
        return new WebDavErrorLogFilter();
    }

    @Bean
    public FilterRegistrationBean<BasicAuthFilter> basicAuthFilterRegistration(BasicAuthFilter filter) {
        FilterRegistrationBean<BasicAuthFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setName("basicAuthFilter");
        registration.setOrder(1);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ContentTypeHintFilter> contentTypeHintFilterRegistration(
            ContentTypeHintFilter filter) {
        FilterRegistrationBean<ContentTypeHintFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setName("contentTypeHintFilter");
        registration.setOrder(2);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<QuotaReportFilter> quotaReportFilterRegistration(QuotaReportFilter filter) {
        FilterRegistrationBean<QuotaReportFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setName("quotaReportFilter");
        registration.setOrder(3);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<WebDavErrorLogFilter> webDavErrorLogFilterRegistration(WebDavErrorLogFilter filter) {
        FilterRegistrationBean<WebDavErrorLogFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setName("webDavErrorLogFilter");
        registration.setOrder(4);
        return registration;
    }

    /**
     * WebDAV 프로토콜 엔진 등록.
     * readonly=false로 쓰기 메서드(PUT, MKCOL, DELETE, COPY, MOVE, LOCK)를 허용합니다.
     */
    @Bean
    public ServletRegistrationBean<WebdavServlet> webdavServlet() {
        ServletRegistrationBean<WebdavServlet> registration =
                new ServletRegistrationBean<>(new WebdavServlet(), "/*");
        registration.setName("webdav");
        registration.addInitParameter("readonly", "false");
        registration.addInitParameter("listings", "true");
        registration.setLoadOnStartup(1);
        return registration;
    }

    /**
     * 데이터 디렉토리를 Tomcat document root로 지정합니다.
     * WebdavServlet은 이 document root를 WebDAV 공유 루트로 사용합니다.
     */
    @Bean
    public WebServerFactoryCustomizer<TomcatServletWebServerFactory> dataRootCustomizer() {
        return factory -> {
            factory.setDocumentRoot(atlasServerProperties.getDataRoot().toFile());
            log.info("=== [ATLAS CONFIG] WebDAV 루트: {} ===", atlasServerProperties.getDataRoot());
        };
    }
}

package com.example.atlas.server;

import com.example.atlas.server.config.AtlasServerProperties;
import com.example.atlas.server.config.QuotaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.servlet.error.ErrorMvcAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Atlas WebDAV 파일 공유 서버 애플리케이션.
 * <p>
 * Tomcat 내장 WebdavServlet이 WebDAV 프로토콜(PROPFIND, GET, PUT, MKCOL, LOCK, COPY, MOVE 등)을
 * 처리하고, 이 애플리케이션은 그 앞단에 필터 체인을 구성합니다.
 * </p>
 *
 * <h3>요청 흐름:</h3>
 * <ol>
 *   <li>BasicAuthFilter → users.json 기반 Basic 인증</li>
 *   <li>ContentTypeHintFilter → 확장자 기반 Content-Type 힌트</li>
 *   <li>QuotaReportFilter → 루트 PROPFIND 응답에 쿼터 속성(RFC 4331) 주입</li>
 *   <li>WebDavErrorLogFilter → 엔진 오류 응답 로깅</li>
 *   <li>WebdavServlet → 데이터 디렉토리에 대한 실제 WebDAV 처리</li>
 * </ol>
 *
 * <p>
 * /* 경로 전체를 WebdavServlet이 처리하므로 /error 포워딩(ErrorMvcAutoConfiguration)은 사용하지 않습니다.
 * </p>
 */
@SpringBootApplication(exclude = ErrorMvcAutoConfiguration.class)
@EnableConfigurationProperties({
        AtlasServerProperties.class,
        QuotaProperties.class
})
public class AtlasServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtlasServerApplication.class, args);
    }
}

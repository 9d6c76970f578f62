package com.example.atlas.server.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Atlas 서버 핵심 설정
 */
@Slf4j
@Getter
@Setter
@ConfigurationProperties(prefix = "atlas")
public class AtlasServerProperties {

    /** WebDAV로 공유할 데이터 디렉토리 경로 (WebdavServlet의 document root) */
    private String dataDir = "data";

    /** 사용자 자격 증명 JSON 파일 경로 */
    private String usersFile = "./users.json";

    /** Basic 인증 실패 시 WWW-Authenticate 헤더에 실리는 realm 이름 */
    private String realm = "Atlas Storage";

    /**
     * 데이터 디렉토리의 절대 경로를 반환합니다.
     * 쿼터 계산과 WebdavServlet document root 모두 이 경로를 기준으로 합니다.
     */
    public Path getDataRoot() {
        return Paths.get(dataDir).toAbsolutePath().normalize();
    }

    /**
     * 서버 시작 시 데이터 디렉토리가 존재하지 않으면 자동 생성합니다.
     * WebdavServlet이 파일을 읽고 쓸 document root가 반드시 필요합니다.
     */
    @PostConstruct
    public void init() throws IOException {
        Path path = getDataRoot();
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            log.info("=== [ATLAS CONFIG] 데이터 디렉토리 생성: {} ===", path);
        } else {
            log.info("=== [ATLAS CONFIG] 데이터 디렉토리 확인 완료: {} ===", path);
        }
        log.info("=== [ATLAS CONFIG] 사용자 파일: {} ===", Paths.get(usersFile).toAbsolutePath());
    }
}

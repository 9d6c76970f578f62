package com.example.atlas.server.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * WebDAV 엔진 오류 로깅 필터.
 * <p>
 * 엔진이 4xx/5xx로 응답했거나 예외를 던진 요청을 메서드와 경로와 함께 WARN으로 남깁니다.
 * Windows 탐색기가 폴더를 열 때마다 조회하는 시스템 파일의 404는 기록하지 않습니다.
 * </p>
 */
@Slf4j
public class WebDavErrorLogFilter extends OncePerRequestFilter {

    static final Set<String> SILENT_NOT_FOUND_NAMES =
            Set.of("desktop.ini", "autorun.inf", "thumbs.db", "folder.jpg");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain)
            throws ServletException, IOException {

        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.warn("=== [WEBDAV ERROR] {} {}: {} ===", request.getMethod(), request.getRequestURI(), e.toString());
            throw e;
        }

        int status = response.getStatus();
        if (status < HttpServletResponse.SC_BAD_REQUEST || isSilent(request.getRequestURI(), status)) {
            return;
        }
        log.warn("=== [WEBDAV ERROR] {} {}: status={} ===", request.getMethod(), request.getRequestURI(), status);
    }

    static boolean isSilent(String path, int status) {
        if (status != HttpServletResponse.SC_NOT_FOUND) {
            return false;
        }
        String name = StringUtils.getFilename(path);
        return name != null && SILENT_NOT_FOUND_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }
}

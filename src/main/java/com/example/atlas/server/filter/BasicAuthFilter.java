package com.example.atlas.server.filter;

import com.example.atlas.server.store.UserStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Basic 인증 서블릿 필터.
 * <p>
 * 모든 요청의 Authorization 헤더에서 Basic 자격 증명을 추출해 {@link UserStore}로 검증합니다.
 * 세션/토큰 캐시가 없으므로 매 요청마다 bcrypt 비교 비용을 그대로 지불합니다.
 * </p>
 *
 * <h3>처리 흐름:</h3>
 * <ol>
 *   <li>자격 증명 없음 또는 형식 오류 → 401 + WWW-Authenticate, 다음 단계로 전달하지 않음</li>
 *   <li>인증 실패 → 401, 시도한 사용자명만 로그에 남김 (비밀번호는 남기지 않음)</li>
 *   <li>인증 성공 → 요청을 그대로 다음 필터로 전달</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public class BasicAuthFilter extends OncePerRequestFilter {

    private static final String BASIC_PREFIX = "Basic ";

    private final UserStore userStore;
    private final String realm;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain)
            throws ServletException, IOException {

        String[] credentials = extractCredentials(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (credentials == null) {
            log.debug("=== [AUTH] 자격 증명 없음: {} {} ===", request.getMethod(), request.getRequestURI());
            unauthorized(response);
            return;
        }

        String username = credentials[0];
        if (!userStore.authenticate(username, credentials[1])) {
            log.warn("=== [AUTH] 인증 실패 user={} ===", username);
            unauthorized(response);
            return;
        }

        chain.doFilter(request, response);
    }

    /**
     * Authorization 헤더에서 [username, password]를 추출합니다.
     * <p>
     * 형식: "Basic base64(username:password)". 스킴이 다르거나 Base64 디코딩에 실패하거나
     * ':' 구분자가 없으면 null을 반환합니다.
     * </p>
     */
    static String[] extractCredentials(String header) {
        if (header == null || header.length() < BASIC_PREFIX.length()
                || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return null;
        }

        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim());
            decoded = new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }

        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return null;
        }
        return new String[]{decoded.substring(0, colon), decoded.substring(colon + 1)};
    }

    private void unauthorized(HttpServletResponse response) throws IOException {
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + realm + "\"");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("text/plain;charset=UTF-8");
        response.getWriter().write("Unauthorized");
    }
}

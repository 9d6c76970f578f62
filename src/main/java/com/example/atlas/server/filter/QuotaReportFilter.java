package com.example.atlas.server.filter;

import com.example.atlas.server.dto.DiskUsage;
import com.example.atlas.server.service.QuotaPropertyInjector;
import com.example.atlas.server.service.UsageProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 디스크 쿼터 보고 서블릿 필터 (RFC 4331).
 * <p>
 * 공유 루트("/")에 대한 PROPFIND 응답에만 quota-available-bytes / quota-used-bytes 속성을 주입합니다.
 * 그 외 모든 요청은 응답 객체를 감싸지 않고 그대로 엔진에 넘기므로 버퍼링 비용이 없습니다.
 * </p>
 *
 * <h3>처리 흐름 (PROPFIND /):</h3>
 * <ol>
 *   <li>응답을 ContentCachingResponseWrapper로 감싸 상태 코드와 본문 전체를 버퍼에 모음</li>
 *   <li>WebdavServlet에 버퍼를 응답으로 넘겨 처리 위임</li>
 *   <li>상태가 207 Multi-Status가 아니면 버퍼 내용을 그대로 내보냄</li>
 *   <li>207이면 UsageProvider로 여유/사용량 계산 → 본문에 쿼터 속성 주입</li>
 *   <li>Content-Length를 최종 본문 길이로 다시 설정하고 내보냄</li>
 * </ol>
 *
 * <p>
 * 본문을 쓰기 시작하면 헤더가 커밋되므로, 본문 수정 후 Content-Length를 맞추려면 전체를 버퍼링해야 합니다.
 * 메모리 사용량은 루트 목록 응답 크기에 비례합니다.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class QuotaReportFilter extends OncePerRequestFilter {

    static final String PROPFIND = "PROPFIND";

    static final int SC_MULTI_STATUS = 207;

    static final String DEFAULT_CONTENT_TYPE = "text/xml; charset=utf-8";

    private final UsageProvider usageProvider;
    private final QuotaPropertyInjector quotaPropertyInjector;
    private final Path dataRoot;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain)
            throws ServletException, IOException {

        if (!isRootPropfind(request)) {
            chain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper buffer = new ContentCachingResponseWrapper(response);
        chain.doFilter(request, buffer);

        int status = buffer.getStatus();
        if (status != SC_MULTI_STATUS) {
            log.debug("=== [QUOTA] PROPFIND / status={}, 그대로 전달 ===", status);
            buffer.copyBodyToResponse();
            return;
        }

        byte[] body = buffer.getContentAsByteArray();
        try {
            DiskUsage usage = usageProvider.getUsage(dataRoot);
            body = quotaPropertyInjector.inject(body, usage);
            log.debug("=== [QUOTA] 쿼터 보고 free={}, used={} ===", usage.getFreeBytes(), usage.getUsedBytes());
        } catch (IOException | RuntimeException e) {
            log.warn("=== [QUOTA] 디스크 사용량 계산 실패, 쿼터 없이 응답: {} ===", e.toString());
        }

        writeBody(response, status, body);
    }

    private boolean isRootPropfind(HttpServletRequest request) {
        if (!PROPFIND.equalsIgnoreCase(request.getMethod())) {
            return false;
        }
        String path = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)) {
            path = path.substring(contextPath.length());
        }
        return "/".equals(path);
    }

    private void writeBody(HttpServletResponse response, int status, byte[] body) throws IOException {
        response.setStatus(status);
        response.setContentLength(body.length);
        if (response.getContentType() == null) {
            response.setContentType(DEFAULT_CONTENT_TYPE);
        }
        response.getOutputStream().write(body);
        response.flushBuffer();
    }
}

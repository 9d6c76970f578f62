package com.example.atlas.server.filter;

import com.example.atlas.server.dto.DiskUsage;
import com.example.atlas.server.service.QuotaPropertyInjector;
import com.example.atlas.server.service.UsageProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuotaReportFilterTest {

    private static final String LISTING = "<?xml version=\"1.0\" encoding=\"utf-8\" ?>"
            + "<D:multistatus xmlns:D=\"DAV:\"><D:response><D:href>/</D:href>"
            + "<D:propstat><D:prop><D:displayname></D:displayname></D:prop>"
            + "<D:status>HTTP/1.1 200 OK</D:status></D:propstat></D:response></D:multistatus>";

    private final Path dataRoot = Paths.get("/srv/atlas/data");
    private final UsageProvider usageProvider = mock(UsageProvider.class);
    private final QuotaReportFilter filter =
            new QuotaReportFilter(usageProvider, new QuotaPropertyInjector(), dataRoot);

    @Test
    @DisplayName("루트 PROPFIND 207 응답에 쿼터 속성을 주입하고 Content-Length를 다시 계산한다")
    void injectsQuotaIntoRootListing() throws Exception {
        when(usageProvider.getUsage(dataRoot)).thenReturn(new DiskUsage(6, 4));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response, engine(207, LISTING));

        String body = response.getContentAsString(StandardCharsets.UTF_8);
        assertThat(response.getStatus()).isEqualTo(207);
        assertThat(body).contains("<D:quota-available-bytes>6</D:quota-available-bytes>"
                + "<D:quota-used-bytes>4</D:quota-used-bytes></D:prop>");
        assertThat(response.getContentLength()).isEqualTo(response.getContentAsByteArray().length);
        assertThat(response.getHeader("Content-Length"))
                .isEqualTo(String.valueOf(response.getContentAsByteArray().length));
        assertThat(response.getContentType()).startsWith("text/xml");
    }

    @Test
    @DisplayName("PROPFIND가 아닌 요청은 응답을 감싸지 않고 그대로 통과시킨다")
    void passesThroughOtherMethods() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<ServletResponse> seen = new AtomicReference<>();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, (req, res) -> {
            seen.set(res);
            res.getOutputStream().write("hello".getBytes(StandardCharsets.UTF_8));
        });

        assertThat(seen.get()).isSameAs(response);
        assertThat(response.getContentAsString()).isEqualTo("hello");
        verify(usageProvider, never()).getUsage(any());
    }

    @Test
    @DisplayName("루트가 아닌 경로의 PROPFIND는 그대로 통과시킨다")
    void passesThroughNonRootPropfind() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<ServletResponse> seen = new AtomicReference<>();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/docs/"), response, (req, res) -> {
            seen.set(res);
            ((HttpServletResponse) res).setStatus(207);
            res.getWriter().write(LISTING);
        });

        assertThat(seen.get()).isSameAs(response);
        assertThat(response.getContentAsString()).isEqualTo(LISTING);
        verify(usageProvider, never()).getUsage(any());
    }

    @Test
    @DisplayName("207이 아닌 루트 PROPFIND 응답은 상태와 본문을 그대로 내보낸다")
    void passesThroughNonMultiStatus() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        byte[] original = "<error>locked</error>".getBytes(StandardCharsets.UTF_8);

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response, (req, res) -> {
            ((HttpServletResponse) res).setStatus(423);
            res.getOutputStream().write(original);
        });

        assertThat(response.getStatus()).isEqualTo(423);
        assertThat(response.getContentAsByteArray()).isEqualTo(original);
        verify(usageProvider, never()).getUsage(any());
    }

    @Test
    @DisplayName("엔진이 상태를 설정하지 않으면 200으로 보고 그대로 내보낸다")
    void defaultStatusIsOk() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response,
                (req, res) -> res.getWriter().write(LISTING));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getContentAsString()).isEqualTo(LISTING);
    }

    @Test
    @DisplayName("사용량 계산이 실패해도 원본 목록을 그대로 응답한다")
    void usageFailureServesOriginalListing() throws Exception {
        when(usageProvider.getUsage(dataRoot)).thenThrow(new IOException("stat failed"));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response, engine(207, LISTING));

        assertThat(response.getStatus()).isEqualTo(207);
        assertThat(response.getContentAsString(StandardCharsets.UTF_8)).isEqualTo(LISTING);
        assertThat(response.getContentLength()).isEqualTo(LISTING.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    @DisplayName("엔진이 Content-Type을 설정하지 않으면 text/xml을 기본으로 설정한다")
    void setsDefaultContentType() throws Exception {
        when(usageProvider.getUsage(dataRoot)).thenReturn(new DiskUsage(1, 1));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response, (req, res) -> {
            ((HttpServletResponse) res).setStatus(207);
            res.getOutputStream().write(LISTING.getBytes(StandardCharsets.UTF_8));
        });

        assertThat(response.getContentType()).startsWith("text/xml");
    }

    private static FilterChain engine(int status, String body) {
        return (req, res) -> {
            HttpServletResponse http = (HttpServletResponse) res;
            http.setStatus(status);
            http.setContentType("text/xml; charset=UTF-8");
            http.getWriter().write(body);
            http.getWriter().flush();
        };
    }
}

package com.example.atlas.server.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTypeHintFilterTest {

    private final ContentTypeHintFilter filter = new ContentTypeHintFilter();

    @Test
    @DisplayName("확장자로 Content-Type을 설정한 뒤 요청을 전달한다")
    void setsContentTypeFromExtension() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/docs/notes.txt"), response, chain);

        assertThat(response.getContentType()).startsWith("text/plain");
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("이미지 확장자도 인식한다")
    void recognizesImages() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/photos/cat.png"), response, new MockFilterChain());

        assertThat(response.getContentType()).isEqualTo("image/png");
    }

    @Test
    @DisplayName("확장자가 없으면 Content-Type을 건드리지 않는다")
    void leavesExtensionlessPathsAlone() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("PROPFIND", "/"), response, chain);
        filter.doFilter(new MockHttpServletRequest("GET", "/v1.2/README"), response, new MockFilterChain());

        assertThat(response.getContentType()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }
}

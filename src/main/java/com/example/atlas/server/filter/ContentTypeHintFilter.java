package com.example.atlas.server.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * 확장자 기반 Content-Type 힌트 필터.
 * <p>
 * Windows WebDAV 클라이언트는 서버가 내려주는 Content-Type에 의존하는 경우가 많아,
 * 요청 경로의 확장자로 미디어 타입을 찾아 엔진 호출 전에 응답에 미리 설정합니다.
 * 알 수 없는 확장자이거나 확장자가 없으면 아무것도 설정하지 않습니다.
 * </p>
 */
public class ContentTypeHintFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain)
            throws ServletException, IOException {

        String extension = StringUtils.getFilenameExtension(request.getRequestURI());
        if (StringUtils.hasText(extension)) {
            Optional<MediaType> mediaType = MediaTypeFactory.getMediaType("file." + extension);
            mediaType.ifPresent(type -> response.setContentType(type.toString()));
        }

        chain.doFilter(request, response);
    }
}

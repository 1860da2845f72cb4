package com.edge.mosaic.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 /api 请求的方法、路径、耗时、状态码以及 JSON 请求/响应体（截断）
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_REQUEST_BODY = 1000;
    private static final int MAX_RESPONSE_BODY = 5000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // swagger 静态资源和文档不记录
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        logger.info(">>> {} {}", request.getMethod(), request.getRequestURI());

        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if ("POST".equalsIgnoreCase(request.getMethod()) || "PUT".equalsIgnoreCase(request.getMethod())) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.info("Request Body: {}", truncate(new String(content, StandardCharsets.UTF_8), MAX_REQUEST_BODY));
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = responseWrapper.getContentType();
            // 只有文本类响应才打印
            if (responseContent.length > 0 && contentType != null
                    && (contentType.contains("json") || contentType.contains("text"))) {
                logger.info("Response Body: {}",
                        truncate(new String(responseContent, StandardCharsets.UTF_8), MAX_RESPONSE_BODY));
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("<<< {} {} | Duration: {} ms | Status: {}",
                    request.getMethod(), request.getRequestURI(), duration, response.getStatus());
        }
    }

    static String truncate(String body, int max) {
        return body.length() > max ? body.substring(0, max) + "..." : body;
    }
}

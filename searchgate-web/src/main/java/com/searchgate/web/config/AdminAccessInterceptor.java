package com.searchgate.web.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchgate.common.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 管理接口鉴权：请求头中的口令与配置一致才放行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminAccessInterceptor implements HandlerInterceptor {

    private final WebProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (isAdmin(request)) {
            return true;
        }
        log.debug("拒绝非管理员访问: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.error("FORBIDDEN", "需要管理员权限"));
        return false;
    }

    public boolean isAdmin(HttpServletRequest request) {
        if (properties.isDevOpenAdmin()) {
            return true;
        }
        String expected = properties.getAdminToken();
        if (expected == null || expected.isEmpty()) {
            return false;
        }
        String actual = request.getHeader(properties.getAdminHeader());
        return actual != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}

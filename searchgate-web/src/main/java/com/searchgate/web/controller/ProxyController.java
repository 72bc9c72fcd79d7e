package com.searchgate.web.controller;

import com.searchgate.common.exception.UnauthorizedException;
import com.searchgate.dispatcher.proxy.ProxyRequest;
import com.searchgate.dispatcher.proxy.ProxyService;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.web.config.WebProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * MCP 代理入口：{@code /mcp} 与 {@code /mcp/**} 接受任意方法。
 * <p>
 * 调用方携带 {@code Authorization: Bearer sg-<id>-<secret>}，该头部不会转发给上游。
 * 不支持 GET 方式建立 SSE 长连接（返回 405）。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private static final String BEARER_PREFIX = "Bearer ";

    /** 不回传给调用方的响应头 */
    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "transfer-encoding", "content-length", "upgrade",
            "proxy-authenticate", "proxy-authorization", "te", "trailer");

    private final ProxyService proxyService;
    private final WebProperties properties;

    @RequestMapping({"/mcp", "/mcp/**"})
    public ResponseEntity<byte[]> proxy(HttpServletRequest request) throws IOException {
        if ("GET".equalsIgnoreCase(request.getMethod()) && acceptsEventStream(request)) {
            return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).build();
        }

        String bearer = bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (bearer == null) {
            throw new UnauthorizedException("缺少访问令牌");
        }

        if (request.getContentLengthLong() > properties.getMaxBodyBytes()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).build();
        }
        byte[] body = readBody(request.getInputStream());
        if (body.length > properties.getMaxBodyBytes()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).build();
        }

        ForwardResponse upstream = proxyService.handle(ProxyRequest.builder()
                .method(request.getMethod())
                .path(request.getRequestURI().substring(request.getContextPath().length()))
                .query(request.getQueryString())
                .headers(headers(request))
                .body(body)
                .bearerToken(bearer)
                .build());

        HttpHeaders responseHeaders = new HttpHeaders();
        upstream.getHeaders().forEach((name, value) -> {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                responseHeaders.add(name, value);
            }
        });
        return ResponseEntity.status(upstream.getStatus()).headers(responseHeaders).body(upstream.getBody());
    }

    private byte[] readBody(InputStream in) throws IOException {
        long limit = properties.getMaxBodyBytes() + 1;
        return in.readNBytes((int) Math.min(Integer.MAX_VALUE, limit));
    }

    private static boolean acceptsEventStream(HttpServletRequest request) {
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        return accept != null && accept.toLowerCase(Locale.ROOT).contains("text/event-stream");
    }

    static String bearerToken(String authorization) {
        if (authorization == null) {
            return null;
        }
        String value = authorization.trim();
        if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = value.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", Collections.list(request.getHeaders(name))));
        }
        return headers;
    }
}

package com.searchgate.upstream.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchgate.common.exception.UpstreamException;
import com.searchgate.common.exception.UsageSyncException;
import com.searchgate.common.util.SensitiveDataRedactor;
import com.searchgate.upstream.config.UpstreamProperties;
import com.searchgate.upstream.model.ForwardRequest;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.upstream.model.UsageSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tavily MCP 上游实现：Key 以查询参数附加，用量通过 /usage 接口查询。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TavilyProvider implements UpstreamProvider {

    private final OkHttpClient upstreamHttpClient;
    private final UpstreamProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final int MAX_ERROR_BODY = 512;

    // ======================== 请求转发 ========================

    @Override
    public ForwardResponse forward(ForwardRequest request, String apiKey) {
        HttpUrl url = buildUrl(request, apiKey);

        Request.Builder builder = new Request.Builder().url(url);
        String contentType = null;
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            if ("content-type".equalsIgnoreCase(header.getKey())) {
                contentType = header.getValue();
            }
            builder.addHeader(header.getKey(), header.getValue());
        }

        String method = request.getMethod().toUpperCase();
        builder.method(method, buildBody(method, request.getBody(), contentType));

        try (Response response = upstreamHttpClient.newCall(builder.build()).execute()) {
            byte[] body = response.body() != null ? response.body().bytes() : new byte[0];

            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : response.headers().names()) {
                headers.put(name, response.header(name));
            }

            if (!response.isSuccessful()) {
                log.warn("上游返回错误: {} {} -> {}", method, request.getPath(), response.code());
            }
            return ForwardResponse.builder()
                    .status(response.code())
                    .headers(headers)
                    .body(body)
                    .build();

        } catch (IOException e) {
            throw new UpstreamException(
                    "调用上游时发生网络错误: " + SensitiveDataRedactor.redact(e.getMessage()), e);
        }
    }

    // ======================== 用量查询 ========================

    @Override
    public UsageSnapshot fetchUsage(String apiKey) {
        Request request = new Request.Builder()
                .url(properties.getUsageUrl())
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Accept", "application/json")
                .get()
                .build();

        try (Response response = upstreamHttpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.warn("用量查询失败: Key {} -> {}", SensitiveDataRedactor.maskKey(apiKey), response.code());
                throw new UsageSyncException(UsageSyncException.Reason.USAGE_HTTP, response.code(),
                        "用量接口返回 " + response.code() + ": " + truncate(body));
            }

            JsonNode json = objectMapper.readTree(body);
            JsonNode keyNode = json.path("key");
            JsonNode accountNode = json.path("account");

            Long limit = firstNumber(keyNode.path("limit"), accountNode.path("plan_limit"));
            Long usage = firstNumber(keyNode.path("usage"), accountNode.path("plan_usage"));
            if (limit == null || usage == null) {
                throw new UsageSyncException(UsageSyncException.Reason.QUOTA_DATA_MISSING, response.code(),
                        "用量响应缺少 limit/usage 字段");
            }

            return UsageSnapshot.builder()
                    .limit(limit)
                    .remaining(Math.max(0, limit - usage))
                    .fetchedAt(clock.instant().getEpochSecond())
                    .build();

        } catch (UsageSyncException e) {
            throw e;
        } catch (IOException e) {
            throw new UsageSyncException("查询上游用量时发生网络错误", e);
        }
    }

    @Override
    public boolean isQuotaExhausted(int statusCode) {
        return statusCode == properties.getQuotaExhaustedStatus();
    }

    @Override
    public String getProviderName() {
        return "tavily";
    }

    // ======================== 内部方法 ========================

    private HttpUrl buildUrl(ForwardRequest request, String apiKey) {
        String raw = properties.getBaseUrl() + request.getPath();
        if (request.getQuery() != null && !request.getQuery().isEmpty()) {
            raw = raw + "?" + request.getQuery();
        }
        HttpUrl parsed = HttpUrl.parse(raw);
        if (parsed == null) {
            throw new UpstreamException("非法的上游地址: " + properties.getBaseUrl() + request.getPath());
        }
        return parsed.newBuilder()
                .removeAllQueryParameters(properties.getKeyQueryParam())
                .addQueryParameter(properties.getKeyQueryParam(), apiKey)
                .build();
    }

    private RequestBody buildBody(String method, byte[] body, String contentType) {
        boolean permitsBody = !"GET".equals(method) && !"HEAD".equals(method);
        if (!permitsBody) {
            return null;
        }
        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
        return RequestBody.create(body != null ? body : new byte[0], mediaType);
    }

    private Long firstNumber(JsonNode... candidates) {
        for (JsonNode node : candidates) {
            if (node != null && node.isNumber()) {
                return node.asLong();
            }
        }
        return null;
    }

    private String truncate(String body) {
        if (body == null) return "";
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}

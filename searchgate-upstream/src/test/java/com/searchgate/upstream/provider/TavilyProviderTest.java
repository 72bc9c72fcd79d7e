package com.searchgate.upstream.provider;

import com.searchgate.common.exception.UpstreamException;
import com.searchgate.common.exception.UsageSyncException;
import com.searchgate.upstream.config.UpstreamModuleConfig;
import com.searchgate.upstream.config.UpstreamProperties;
import com.searchgate.upstream.model.ForwardRequest;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.upstream.model.UsageSnapshot;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TavilyProvider")
class TavilyProviderTest {

    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    private MockWebServer server;
    private TavilyProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        UpstreamProperties properties = new UpstreamProperties();
        properties.setBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        properties.setUsageUrl(server.url("/usage").toString());
        properties.setRequestTimeoutSeconds(5);
        provider = new TavilyProvider(new UpstreamModuleConfig().upstreamHttpClient(properties), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("转发时以查询参数附加 Key，并覆盖调用方传入的同名参数")
    void forwardAppendsKeyAsQueryParameter() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setHeader("Mcp-Session-Id", "s-9")
                .setBody("{\"jsonrpc\":\"2.0\",\"result\":{}}"));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "application/json");
        headers.put("accept", "application/json, text/event-stream");

        ForwardResponse response = provider.forward(ForwardRequest.builder()
                .method("POST")
                .path("/mcp")
                .query("tavilyApiKey=spoofed&debug=1")
                .headers(headers)
                .body("{\"jsonrpc\":\"2.0\",\"id\":1}".getBytes(StandardCharsets.UTF_8))
                .build(), "tvly-real");

        RecordedRequest recorded = server.takeRequest();
        HttpUrl url = recorded.getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/mcp");
        assertThat(url.queryParameterValues("tavilyApiKey")).containsExactly("tvly-real");
        assertThat(url.queryParameter("debug")).isEqualTo("1");
        assertThat(recorded.getHeader("Authorization")).isNull();
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1}");
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeaders()).containsEntry("Mcp-Session-Id", "s-9");
    }

    @Test
    @DisplayName("非 2xx 原样返回，不抛异常")
    void nonSuccessStatusIsReturned() {
        server.enqueue(new MockResponse().setResponseCode(432).setBody("quota"));

        ForwardResponse response = provider.forward(ForwardRequest.builder()
                .method("POST").path("/mcp").body(new byte[0]).build(), "tvly-real");

        assertThat(response.getStatus()).isEqualTo(432);
        assertThat(provider.isQuotaExhausted(response.getStatus())).isTrue();
    }

    @Test
    @DisplayName("网络错误转换为 UpstreamException")
    void networkFailureThrows() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> provider.forward(ForwardRequest.builder()
                .method("GET").path("/mcp").build(), "tvly-real"))
                .isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("用量查询优先使用 key 级数据")
    void fetchUsageReadsKeyLevelNumbers() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"key\":{\"usage\":150,\"limit\":1000},\"account\":{\"plan_usage\":10,\"plan_limit\":50}}"));

        UsageSnapshot snapshot = provider.fetchUsage("tvly-real");

        assertThat(snapshot.getLimit()).isEqualTo(1000);
        assertThat(snapshot.getRemaining()).isEqualTo(850);
        assertThat(snapshot.getFetchedAt()).isEqualTo(NOW.getEpochSecond());
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer tvly-real");
    }

    @Test
    @DisplayName("缺少 key 级数据时退回账户级数据")
    void fetchUsageFallsBackToAccount() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"account\":{\"plan_usage\":1200,\"plan_limit\":1000}}"));

        UsageSnapshot snapshot = provider.fetchUsage("tvly-real");

        assertThat(snapshot.getLimit()).isEqualTo(1000);
        assertThat(snapshot.getRemaining()).isZero();
    }

    @Test
    @DisplayName("用量接口失败或缺字段时抛出 UsageSyncException")
    void fetchUsageFailures() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"detail\":\"bad key\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"key\":{}}"));

        assertThatThrownBy(() -> provider.fetchUsage("tvly-real"))
                .isInstanceOfSatisfying(UsageSyncException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(UsageSyncException.Reason.USAGE_HTTP);
                    assertThat(e.getHttpStatus()).isEqualTo(401);
                });
        assertThatThrownBy(() -> provider.fetchUsage("tvly-real"))
                .isInstanceOfSatisfying(UsageSyncException.class,
                        e -> assertThat(e.getReason()).isEqualTo(UsageSyncException.Reason.QUOTA_DATA_MISSING));
    }
}

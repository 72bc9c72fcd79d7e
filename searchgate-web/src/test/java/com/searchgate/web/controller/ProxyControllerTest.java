package com.searchgate.web.controller;

import com.searchgate.dispatcher.proxy.ProxyRequest;
import com.searchgate.dispatcher.proxy.ProxyService;
import com.searchgate.dispatcher.quota.QuotaVerdict;
import com.searchgate.dispatcher.quota.QuotaWindow;
import com.searchgate.dispatcher.quota.TokenQuotaExceededException;
import com.searchgate.dispatcher.quota.WindowUsage;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.web.config.WebProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProxyController")
class ProxyControllerTest {

    private static final String TOKEN = "sg-ab12-abcdefghijkl";

    @Mock
    private ProxyService proxyService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WebProperties properties = new WebProperties();
        properties.setMaxBodyBytes(64);
        mockMvc = MockMvcBuilders.standaloneSetup(new ProxyController(proxyService, properties))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("解析 Bearer 令牌")
    void parsesBearerToken() {
        assertThat(ProxyController.bearerToken("Bearer " + TOKEN)).isEqualTo(TOKEN);
        assertThat(ProxyController.bearerToken("bearer   " + TOKEN + " ")).isEqualTo(TOKEN);
        assertThat(ProxyController.bearerToken("Basic abc")).isNull();
        assertThat(ProxyController.bearerToken("Bearer ")).isNull();
        assertThat(ProxyController.bearerToken(null)).isNull();
    }

    @Test
    @DisplayName("缺少令牌返回 401")
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/mcp").content("{}").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        verify(proxyService, never()).handle(any());
    }

    @Test
    @DisplayName("GET 建立 SSE 长连接返回 405")
    void getEventStreamIsRejected() throws Exception {
        mockMvc.perform(get("/mcp").header("Accept", "text/event-stream")
                        .header("Authorization", "Bearer " + TOKEN))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    @DisplayName("请求体过大返回 413")
    void oversizedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/mcp").content("x".repeat(100))
                        .header("Authorization", "Bearer " + TOKEN))
                .andExpect(status().isPayloadTooLarge());
    }

    @Test
    @DisplayName("上游响应原样回传，去掉逐跳头部")
    void relaysUpstreamResponse() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Mcp-Session-Id", "s-1");
        headers.put("Transfer-Encoding", "chunked");
        when(proxyService.handle(any(ProxyRequest.class))).thenReturn(ForwardResponse.builder()
                .status(200)
                .headers(headers)
                .body("{\"ok\":true}".getBytes(StandardCharsets.UTF_8))
                .build());

        mockMvc.perform(post("/mcp/tools?a=1").content("{\"id\":1}")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer " + TOKEN))
                .andExpect(status().isOk())
                .andExpect(header().string("Mcp-Session-Id", "s-1"))
                .andExpect(header().doesNotExist("Transfer-Encoding"))
                .andExpect(content().string("{\"ok\":true}"));

        ArgumentCaptor<ProxyRequest> captor = ArgumentCaptor.forClass(ProxyRequest.class);
        verify(proxyService).handle(captor.capture());
        assertThat(captor.getValue().getPath()).isEqualTo("/mcp/tools");
        assertThat(captor.getValue().getQuery()).isEqualTo("a=1");
        assertThat(captor.getValue().getBearerToken()).isEqualTo(TOKEN);
        assertThat(new String(captor.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":1}");
    }

    @Test
    @DisplayName("令牌超额返回 429 及各窗口用量")
    void tokenQuotaExceeded() throws Exception {
        WindowUsage full = new WindowUsage(100, 100, 1_741_600_000L);
        WindowUsage ok = new WindowUsage(500, 100, 1_741_680_000L);
        QuotaVerdict verdict = QuotaVerdict.builder().allowed(false).exceededWindow(QuotaWindow.HOUR)
                .hourly(full).daily(ok).monthly(ok).build();
        when(proxyService.handle(any(ProxyRequest.class)))
                .thenThrow(new TokenQuotaExceededException("ab12", verdict));

        mockMvc.perform(post("/mcp").content("{}").header("Authorization", "Bearer " + TOKEN))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("quota_exceeded"))
                .andExpect(jsonPath("$.window").value("hour"))
                .andExpect(jsonPath("$.hourly.used").value(100))
                .andExpect(jsonPath("$.hourly.reset_at").value(1_741_600_000L));
    }
}

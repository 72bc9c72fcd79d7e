package com.searchgate.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    @Test
    @DisplayName("抹去查询参数中的上游 Key，大小写不敏感")
    void redactsQueryParameter() {
        assertThat(SensitiveDataRedactor.redact("a=1&tavilyApiKey=tvly-abc123&b=2"))
                .isEqualTo("a=1&tavilyApiKey=<redacted>&b=2");
        assertThat(SensitiveDataRedactor.redact("https://mcp.tavily.com/mcp?TAVILYAPIKEY=tvly-x"))
                .isEqualTo("https://mcp.tavily.com/mcp?TAVILYAPIKEY=<redacted>");
    }

    @Test
    @DisplayName("抹去头部形式的上游 Key")
    void redactsHeader() {
        assertThat(SensitiveDataRedactor.redact("Tavily-Api-Key: tvly-secret\nAccept: */*"))
                .isEqualTo("Tavily-Api-Key: <redacted>\nAccept: */*");
    }

    @Test
    @DisplayName("空值原样返回")
    void nullAndEmpty() {
        assertThat(SensitiveDataRedactor.redact(null)).isNull();
        assertThat(SensitiveDataRedactor.redact("")).isEmpty();
    }

    @Test
    @DisplayName("日志中只保留 Key 前缀")
    void masksKey() {
        assertThat(SensitiveDataRedactor.maskKey("tvly-1234567890")).isEqualTo("tvly-123***");
        assertThat(SensitiveDataRedactor.maskKey("short")).isEqualTo("***");
    }
}

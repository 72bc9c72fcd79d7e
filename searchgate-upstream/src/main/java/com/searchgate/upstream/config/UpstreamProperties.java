package com.searchgate.upstream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上游搜索服务配置项。
 */
@Data
@ConfigurationProperties(prefix = "searchgate.upstream")
public class UpstreamProperties {

    /** 上游 MCP 服务根地址，入站路径原样拼接在其后 */
    private String baseUrl = "https://mcp.tavily.com";

    /** 上游用量查询接口 */
    private String usageUrl = "https://api.tavily.com/usage";

    /** 上游 Key 以查询参数形式附加，参数名 */
    private String keyQueryParam = "tavilyApiKey";

    /** 上游表示“本月配额耗尽”的状态码 */
    private int quotaExhaustedStatus = 432;

    /** 连接超时（秒） */
    private int connectTimeoutSeconds = 10;

    /** 单次上游调用的读超时（秒） */
    private int requestTimeoutSeconds = 60;
}

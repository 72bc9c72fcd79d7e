package com.searchgate.upstream.provider;

import com.searchgate.upstream.model.ForwardRequest;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.upstream.model.UsageSnapshot;

/**
 * 上游搜索服务接口。
 * 通过适配器模式隔离具体厂商协议，调度层只依赖此接口。
 */
public interface UpstreamProvider {

    /**
     * 使用指定 Key 转发一次请求（阻塞式）。
     * <p>
     * 任何 HTTP 状态码都以 {@link ForwardResponse} 返回，只有网络层失败才抛出
     * {@link com.searchgate.common.exception.UpstreamException}。
     *
     * @param request 已过滤头部的请求
     * @param apiKey  上游 Key 明文
     */
    ForwardResponse forward(ForwardRequest request, String apiKey);

    /**
     * 查询某个 Key 在上游的真实配额。
     *
     * @throws com.searchgate.common.exception.UsageSyncException 用量接口失败或缺少配额字段
     */
    UsageSnapshot fetchUsage(String apiKey);

    /**
     * 该状态码是否表示 Key 配额耗尽。
     */
    boolean isQuotaExhausted(int statusCode);

    String getProviderName();
}

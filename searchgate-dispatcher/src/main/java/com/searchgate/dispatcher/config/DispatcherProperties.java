package com.searchgate.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "searchgate.dispatcher")
public class DispatcherProperties {

    // ==================== 令牌配额 ====================

    /** 每令牌滚动 1 小时的默认上限 */
    private long hourlyLimit = 100;

    /** 每令牌滚动 24 小时的默认上限 */
    private long dailyLimit = 500;

    /** 每令牌自然月的默认上限 */
    private long monthlyLimit = 5000;

    /** 月度窗口对齐的参考时区 */
    private String timezone = "UTC";

    // ==================== 代理 ====================

    /** 单次请求最多尝试几个 Key（遇到配额耗尽时换 Key 重试） */
    private int maxKeyAttempts = 3;

    /** 审计日志中请求/响应体的最大保留字符数 */
    private int maxStoredBodyChars = 16384;

    /** 允许转发到上游的请求头（小写） */
    private List<String> forwardHeaders = new ArrayList<>(Arrays.asList(
            "accept", "content-type", "mcp-session-id", "mcp-protocol-version", "last-event-id"));

    /** 无论如何都不转发的请求头（小写），优先级高于白名单 */
    private List<String> blockedHeaders = new ArrayList<>(Arrays.asList(
            "authorization", "cookie", "host", "forwarded", "x-forwarded-for", "x-forwarded-host",
            "x-forwarded-proto", "x-real-ip", "cf-connecting-ip", "true-client-ip", "via"));

    // ==================== 后台任务 ====================

    /** 任务最大尝试次数，用尽后标记为 failed */
    private int jobMaxAttempts = 3;

    /** 退避基数（秒），第 n 次失败后等待 base * 2^(n-1) */
    private long jobBackoffBaseSeconds = 5;

    /** 退避上限（秒） */
    private long jobBackoffMaxSeconds = 300;

    /** 任务线程池大小，与请求线程隔离 */
    private int jobPoolSize = 2;

    /** 扫描到期任务的间隔（毫秒） */
    private long jobPollIntervalMs = 1000;

    /** 每轮最多领取的到期任务数 */
    private int jobBatchSize = 10;

    /** 审计日志保留天数 */
    private int logRetentionDays = 30;

    /** Key 配额多久未同步视为过期（小时） */
    private int quotaSyncStaleHours = 24;

    /** 用量汇总每批读取的日志条数 */
    private int rollupBatchSize = 1000;

    /** 配额同步扫描间隔（毫秒） */
    private long quotaSyncIntervalMs = 3_600_000;

    /** 用量汇总间隔（毫秒） */
    private long usageRollupIntervalMs = 300_000;

    /** 日志清理间隔（毫秒） */
    private long logGcIntervalMs = 3_600_000;

    /** 月度重置检查间隔（毫秒） */
    private long quotaRolloverIntervalMs = 3_600_000;

    // ==================== 实时推送 ====================

    /** 快照推送间隔（毫秒），状态未变化时只发心跳 */
    private long snapshotIntervalMs = 2000;

    /** 快照中附带的最近日志条数 */
    private int snapshotRecentLogs = 200;

    /** 日志查询可达的最大条目数，超出部分不再分页 */
    private int logQueryMaxItems = 10000;

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }
}

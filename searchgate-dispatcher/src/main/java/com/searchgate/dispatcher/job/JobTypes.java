package com.searchgate.dispatcher.job;

/**
 * 后台任务类型与分组。
 */
public final class JobTypes {

    /** 定时同步单个 Key 的上游配额 */
    public static final String QUOTA_SYNC = "quota_sync";

    /** 管理员手动触发的配额同步 */
    public static final String QUOTA_SYNC_MANUAL = "quota_sync/manual";

    /** 审计日志按小时汇总到令牌用量表 */
    public static final String USAGE_ROLLUP = "usage_rollup";

    /** 清理过期日志与配额占用记录 */
    public static final String LOG_GC = "log_gc";

    /** 月初把上月耗尽的 Key 恢复为 active */
    public static final String QUOTA_ROLLOVER = "quota_rollover";

    private JobTypes() {
    }

    /**
     * 分组名转为 job_type 的 LIKE 模式，all 或未知分组返回 null（不过滤）。
     */
    public static String groupPattern(String group) {
        if (group == null) return null;
        switch (group.trim().toLowerCase()) {
            case "quota":
                return QUOTA_SYNC + "%";
            case "usage":
                return USAGE_ROLLUP + "%";
            case "logs":
                return LOG_GC + "%";
            case "rollover":
                return QUOTA_ROLLOVER + "%";
            default:
                return null;
        }
    }
}

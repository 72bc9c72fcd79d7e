package com.searchgate.dispatcher.quota;

import lombok.Builder;
import lombok.Value;

/**
 * 令牌配额判定结果。
 */
@Value
@Builder
public class QuotaVerdict {

    boolean allowed;

    /** 被拒绝时最严格的超限窗口 */
    QuotaWindow exceededWindow;

    WindowUsage hourly;
    WindowUsage daily;
    WindowUsage monthly;

    /** 放行时的占用凭据，只读查询时为 null */
    QuotaReservation reservation;

    /** normal / hour / day / month */
    public String quotaState() {
        return exceededWindow == null ? "normal" : exceededWindow.wireName();
    }
}

package com.searchgate.dispatcher.metrics;

import com.searchgate.dispatcher.quota.QuotaCalendar;

import java.time.Instant;
import java.time.ZoneId;

/**
 * 统计周期，区间为参考时区下的自然日 / 自然周 / 自然月。
 */
public enum MetricsPeriod {

    DAY,
    WEEK,
    MONTH;

    /** 未识别的取值按月处理 */
    public static MetricsPeriod parse(String raw) {
        if (raw == null) return MONTH;
        switch (raw.trim().toLowerCase()) {
            case "day":
                return DAY;
            case "week":
                return WEEK;
            default:
                return MONTH;
        }
    }

    public long start(long now, ZoneId zone) {
        switch (this) {
            case DAY:
                return QuotaCalendar.dayStart(now, zone);
            case WEEK:
                return QuotaCalendar.weekStart(now, zone);
            default:
                return QuotaCalendar.monthStart(now, zone);
        }
    }

    /** 从 since 开始的一个完整周期的结束时间 */
    public long end(long since, ZoneId zone) {
        switch (this) {
            case DAY:
                return Instant.ofEpochSecond(since).atZone(zone).plusDays(1).toEpochSecond();
            case WEEK:
                return Instant.ofEpochSecond(since).atZone(zone).plusDays(7).toEpochSecond();
            default:
                return QuotaCalendar.nextMonthStart(since, zone);
        }
    }
}

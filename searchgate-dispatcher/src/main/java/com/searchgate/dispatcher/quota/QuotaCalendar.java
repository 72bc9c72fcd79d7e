package com.searchgate.dispatcher.quota;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 参考时区下的自然日 / 自然月边界计算，入参与返回值均为 epoch 秒。
 */
public final class QuotaCalendar {

    private QuotaCalendar() {
    }

    public static long monthStart(long epochSecond, ZoneId zone) {
        return startOfMonth(epochSecond, zone).toEpochSecond();
    }

    public static long nextMonthStart(long epochSecond, ZoneId zone) {
        return startOfMonth(epochSecond, zone).plusMonths(1).toEpochSecond();
    }

    /** 上一个自然月的起点 */
    public static long previousMonthStart(long epochSecond, ZoneId zone) {
        return startOfMonth(epochSecond, zone).minusMonths(1).toEpochSecond();
    }

    public static long dayStart(long epochSecond, ZoneId zone) {
        return Instant.ofEpochSecond(epochSecond).atZone(zone).truncatedTo(ChronoUnit.DAYS).toEpochSecond();
    }

    /** 自然周起点（周一） */
    public static long weekStart(long epochSecond, ZoneId zone) {
        ZonedDateTime day = Instant.ofEpochSecond(epochSecond).atZone(zone).truncatedTo(ChronoUnit.DAYS);
        return day.minusDays(day.getDayOfWeek().getValue() - 1L).toEpochSecond();
    }

    private static ZonedDateTime startOfMonth(long epochSecond, ZoneId zone) {
        return Instant.ofEpochSecond(epochSecond).atZone(zone)
                .withDayOfMonth(1)
                .truncatedTo(ChronoUnit.DAYS);
    }
}

package com.searchgate.dispatcher.quota;

import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.data.entity.TokenQuotaHitEntity;
import com.searchgate.data.repository.TokenQuotaHitRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 令牌多窗口配额跟踪。
 * <p>
 * 每个令牌维护一个按时间排序的占用记录队列：小时、日两个窗口从当前时刻向前滚动计数，
 * 月度窗口从参考时区的月初开始计数。占用记录同时写入 t_token_quota_hit，重启后据此重建。
 * 同一令牌的检查与记录在该令牌的锁内完成，并发请求不会超额。
 */
@Slf4j
@Component
public class TokenQuotaTracker {

    private static final long HOUR_SECONDS = 3600;
    private static final long DAY_SECONDS = 86400;

    private final TokenQuotaHitRepository hitRepository;
    private final DispatcherProperties properties;
    private final Clock clock;

    /** tokenId -> 占用记录 */
    private final Map<String, TokenWindow> windows = new ConcurrentHashMap<>();

    public TokenQuotaTracker(TokenQuotaHitRepository hitRepository, DispatcherProperties properties, Clock clock) {
        this.hitRepository = hitRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void rebuild() {
        long now = now();
        windows.clear();
        int loaded = 0;
        for (TokenQuotaHitEntity hit : hitRepository.findSince(retainSince(now))) {
            window(hit.getTokenId()).hits.addLast(new Hit(hit.getId(), hit.getCreatedAt()));
            loaded++;
        }
        log.info("令牌配额窗口重建完成, 令牌 {} 个, 占用记录 {} 条", windows.size(), loaded);
    }

    /**
     * 检查令牌是否还有余量，有则原子地占用一次。
     * 任一窗口已满即拒绝，并报告最严格的超限窗口。
     */
    public QuotaVerdict checkAndRecord(AuthTokenEntity token) {
        TokenWindow window = window(token.getTokenId());
        synchronized (window) {
            long now = now();
            prune(window, now);
            Counts counts = count(window, now);
            QuotaWindow exceeded = tightestExceeded(token, counts);
            if (exceeded != null) {
                log.info("令牌 {} 超出 {} 窗口配额", token.getTokenId(), exceeded.wireName());
                return verdict(token, counts, window, now, exceeded, null);
            }

            TokenQuotaHitEntity saved = hitRepository.save(TokenQuotaHitEntity.builder()
                    .tokenId(token.getTokenId())
                    .createdAt(now)
                    .build());
            window.hits.addLast(new Hit(saved.getId(), now));
            Counts after = new Counts(counts.hour + 1, counts.day + 1, counts.month + 1);
            QuotaReservation reservation = new QuotaReservation(token.getTokenId(), saved.getId(), now);
            return verdict(token, after, window, now, null, reservation);
        }
    }

    /**
     * 退还一次占用（调用最终未成功）。
     */
    public void refund(QuotaReservation reservation) {
        if (reservation == null) {
            return;
        }
        TokenWindow window = window(reservation.getTokenId());
        synchronized (window) {
            Iterator<Hit> it = window.hits.descendingIterator();
            while (it.hasNext()) {
                if (it.next().id == reservation.getHitId()) {
                    it.remove();
                    break;
                }
            }
            hitRepository.deleteById(reservation.getHitId());
        }
        log.debug("退还令牌 {} 的一次配额占用", reservation.getTokenId());
    }

    /**
     * 只读查询当前用量，不占用配额。
     */
    public QuotaVerdict currentUsage(AuthTokenEntity token) {
        TokenWindow window = window(token.getTokenId());
        synchronized (window) {
            long now = now();
            prune(window, now);
            Counts counts = count(window, now);
            return verdict(token, counts, window, now, tightestExceeded(token, counts), null);
        }
    }

    // ==================== 内部方法 ====================

    private QuotaWindow tightestExceeded(AuthTokenEntity token, Counts counts) {
        if (counts.month >= monthlyLimit(token)) return QuotaWindow.MONTH;
        if (counts.day >= dailyLimit(token)) return QuotaWindow.DAY;
        if (counts.hour >= hourlyLimit(token)) return QuotaWindow.HOUR;
        return null;
    }

    private QuotaVerdict verdict(AuthTokenEntity token, Counts counts, TokenWindow window, long now,
                                 QuotaWindow exceeded, QuotaReservation reservation) {
        ZoneId zone = properties.zoneId();
        return QuotaVerdict.builder()
                .allowed(exceeded == null)
                .exceededWindow(exceeded)
                .hourly(new WindowUsage(hourlyLimit(token), counts.hour,
                        rollingReset(window, now - HOUR_SECONDS, HOUR_SECONDS)))
                .daily(new WindowUsage(dailyLimit(token), counts.day,
                        rollingReset(window, now - DAY_SECONDS, DAY_SECONDS)))
                .monthly(new WindowUsage(monthlyLimit(token), counts.month,
                        counts.month == 0 ? null : QuotaCalendar.nextMonthStart(now, zone)))
                .reservation(reservation)
                .build();
    }

    /** 窗口内最早一条记录滑出窗口的时间 */
    private static Long rollingReset(TokenWindow window, long windowStart, long length) {
        for (Hit hit : window.hits) {
            if (hit.at > windowStart) {
                return hit.at + length;
            }
        }
        return null;
    }

    private Counts count(TokenWindow window, long now) {
        long hourStart = now - HOUR_SECONDS;
        long dayStart = now - DAY_SECONDS;
        long monthStart = QuotaCalendar.monthStart(now, properties.zoneId());
        long hour = 0, day = 0, month = 0;
        for (Hit hit : window.hits) {
            if (hit.at > hourStart) hour++;
            if (hit.at > dayStart) day++;
            if (hit.at >= monthStart) month++;
        }
        return new Counts(hour, day, month);
    }

    private void prune(TokenWindow window, long now) {
        long keepSince = retainSince(now);
        while (!window.hits.isEmpty() && window.hits.peekFirst().at < keepSince) {
            window.hits.pollFirst();
        }
    }

    /** 滚动日窗口和本月窗口中较早的那个起点 */
    private long retainSince(long now) {
        return Math.min(now - DAY_SECONDS, QuotaCalendar.monthStart(now, properties.zoneId()));
    }

    private TokenWindow window(String tokenId) {
        return windows.computeIfAbsent(tokenId, k -> new TokenWindow());
    }

    private long hourlyLimit(AuthTokenEntity token) {
        return token.getHourlyLimit() != null ? token.getHourlyLimit() : properties.getHourlyLimit();
    }

    private long dailyLimit(AuthTokenEntity token) {
        return token.getDailyLimit() != null ? token.getDailyLimit() : properties.getDailyLimit();
    }

    private long monthlyLimit(AuthTokenEntity token) {
        return token.getMonthlyLimit() != null ? token.getMonthlyLimit() : properties.getMonthlyLimit();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static final class TokenWindow {
        private final Deque<Hit> hits = new ArrayDeque<>();
    }

    private static final class Hit {
        private final long id;
        private final long at;

        private Hit(long id, long at) {
            this.id = id;
            this.at = at;
        }
    }

    private static final class Counts {
        private final long hour;
        private final long day;
        private final long month;

        private Counts(long hour, long day, long month) {
            this.hour = hour;
            this.day = day;
            this.month = month;
        }
    }
}

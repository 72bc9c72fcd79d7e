package com.searchgate.dispatcher.quota;

import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.data.entity.TokenQuotaHitEntity;
import com.searchgate.data.repository.TokenQuotaHitRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenQuotaTracker")
class TokenQuotaTrackerTest {

    @Mock
    private TokenQuotaHitRepository hitRepository;

    private MutableClock clock;
    private DispatcherProperties properties;
    private TokenQuotaTracker tracker;

    @BeforeEach
    void setUp() {
        AtomicLong ids = new AtomicLong();
        lenient().when(hitRepository.save(any(TokenQuotaHitEntity.class))).thenAnswer(inv -> {
            TokenQuotaHitEntity hit = inv.getArgument(0);
            hit.setId(ids.incrementAndGet());
            return hit;
        });
        clock = MutableClock.at("2025-03-10T08:00:00Z");
        properties = new DispatcherProperties();
        tracker = new TokenQuotaTracker(hitRepository, properties, clock);
    }

    private static AuthTokenEntity token(Long hourly, Long daily, Long monthly) {
        return AuthTokenEntity.builder()
                .tokenId("ab12")
                .hourlyLimit(hourly)
                .dailyLimit(daily)
                .monthlyLimit(monthly)
                .build();
    }

    @Test
    @DisplayName("默认小时限额 100，第 101 次被拒绝")
    void deniesOnceHourlyDefaultReached() {
        AuthTokenEntity token = token(null, null, null);
        for (int i = 0; i < 100; i++) {
            assertThat(tracker.checkAndRecord(token).isAllowed()).isTrue();
        }

        QuotaVerdict denied = tracker.checkAndRecord(token);

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getExceededWindow()).isEqualTo(QuotaWindow.HOUR);
        assertThat(denied.getHourly().getUsed()).isEqualTo(100);
        assertThat(denied.getHourly().getResetAt()).isEqualTo(clock.epochSecond() + 3600);
        assertThat(denied.getReservation()).isNull();
    }

    @Test
    @DisplayName("小时窗口滚动后重新放行")
    void hourlyWindowRolls() {
        AuthTokenEntity token = token(2L, 100L, 1000L);
        tracker.checkAndRecord(token);
        clock.advanceSeconds(600);
        tracker.checkAndRecord(token);
        assertThat(tracker.checkAndRecord(token).isAllowed()).isFalse();

        clock.advanceSeconds(3000);

        QuotaVerdict verdict = tracker.checkAndRecord(token);
        assertThat(verdict.isAllowed()).isTrue();
        assertThat(verdict.getHourly().getUsed()).isEqualTo(2);
        assertThat(verdict.getDaily().getUsed()).isEqualTo(3);
    }

    @Test
    @DisplayName("多个窗口同时超限时报告最严格的窗口")
    void reportsMostRestrictiveWindow() {
        AuthTokenEntity token = token(2L, 2L, 2L);
        tracker.checkAndRecord(token);
        tracker.checkAndRecord(token);

        QuotaVerdict denied = tracker.checkAndRecord(token);

        assertThat(denied.getExceededWindow()).isEqualTo(QuotaWindow.MONTH);
        assertThat(denied.quotaState()).isEqualTo("month");
    }

    @Test
    @DisplayName("退还占用后计数回落")
    void refundReleasesSlot() {
        AuthTokenEntity token = token(1L, 10L, 10L);
        QuotaVerdict verdict = tracker.checkAndRecord(token);

        tracker.refund(verdict.getReservation());

        assertThat(tracker.currentUsage(token).getHourly().getUsed()).isZero();
        assertThat(tracker.checkAndRecord(token).isAllowed()).isTrue();
        verify(hitRepository).deleteById(verdict.getReservation().getHitId());
    }

    @Test
    @DisplayName("月度窗口在参考时区的月初重置")
    void monthlyWindowResetsAtCalendarBoundary() {
        clock.set(Instant.parse("2025-03-31T23:30:00Z"));
        AuthTokenEntity token = token(100L, 100L, 2L);
        tracker.checkAndRecord(token);
        tracker.checkAndRecord(token);
        QuotaVerdict denied = tracker.checkAndRecord(token);
        assertThat(denied.getExceededWindow()).isEqualTo(QuotaWindow.MONTH);
        assertThat(denied.getMonthly().getResetAt())
                .isEqualTo(Instant.parse("2025-04-01T00:00:00Z").getEpochSecond());

        clock.set(Instant.parse("2025-04-01T00:00:01Z"));

        QuotaVerdict verdict = tracker.checkAndRecord(token);
        assertThat(verdict.isAllowed()).isTrue();
        assertThat(verdict.getMonthly().getUsed()).isEqualTo(1);
        assertThat(verdict.getDaily().getUsed()).isEqualTo(3);
    }

    @Test
    @DisplayName("重启后从占用记录重建窗口")
    void rebuildsFromPersistedHits() {
        long now = clock.epochSecond();
        when(hitRepository.findSince(anyLong())).thenReturn(List.of(
                new TokenQuotaHitEntity(1L, "ab12", now - 7200),
                new TokenQuotaHitEntity(2L, "ab12", now - 60)));

        tracker.rebuild();

        QuotaVerdict usage = tracker.currentUsage(token(null, null, null));
        assertThat(usage.getHourly().getUsed()).isEqualTo(1);
        assertThat(usage.getDaily().getUsed()).isEqualTo(2);
        assertThat(usage.isAllowed()).isTrue();
    }
}

package com.searchgate.dispatcher.pool;

import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NoEligibleKeyException;
import com.searchgate.data.entity.ApiKeyEntity;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.data.repository.ApiKeyRepository;
import com.searchgate.dispatcher.support.MutableClock;
import com.searchgate.upstream.model.UsageSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcApiKeyPool")
class JdbcApiKeyPoolTest {

    @Mock
    private ApiKeyRepository repository;

    private MutableClock clock;
    private JdbcApiKeyPool pool;

    @BeforeEach
    void setUp() {
        AtomicLong ids = new AtomicLong();
        lenient().when(repository.save(any(ApiKeyEntity.class))).thenAnswer(inv -> {
            ApiKeyEntity entity = inv.getArgument(0);
            if (entity.getId() == null) {
                entity.setId(ids.incrementAndGet());
            }
            return entity;
        });
        when(repository.findAllOrdered()).thenReturn(List.of());
        clock = MutableClock.at("2025-03-10T08:00:00Z");
        pool = new JdbcApiKeyPool(repository, clock);
        pool.load();
    }

    @Test
    @DisplayName("按最久未使用轮转 Key")
    void selectsLeastRecentlyUsed() {
        pool.addKey("tvly-aaa");
        pool.addKey("tvly-bbb");

        SelectedKey first = pool.selectKey(Set.of());
        clock.advanceSeconds(1);
        SelectedKey second = pool.selectKey(Set.of());
        clock.advanceSeconds(1);
        SelectedKey third = pool.selectKey(Set.of());

        assertThat(second.getKeyId()).isNotEqualTo(first.getKeyId());
        assertThat(third.getKeyId()).isEqualTo(first.getKeyId());
        assertThat(first.isFallback()).isFalse();
    }

    @Test
    @DisplayName("排除集合中的 Key 不会被选中")
    void skipsExcludedKeys() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        ApiKeyEntity b = pool.addKey("tvly-bbb");

        SelectedKey selected = pool.selectKey(Set.of(a.getKeyId()));

        assertThat(selected.getKeyId()).isEqualTo(b.getKeyId());
        assertThatThrownBy(() -> pool.selectKey(Set.of(a.getKeyId(), b.getKeyId())))
                .isInstanceOf(NoEligibleKeyException.class);
    }

    @Test
    @DisplayName("没有 active Key 时兜底使用禁用最久的 Key")
    void fallsBackToLongestDisabled() {
        ApiKeyEntity older = pool.addKey("tvly-old");
        ApiKeyEntity newer = pool.addKey("tvly-new");
        pool.updateStatus(older.getKeyId(), KeyStatus.DISABLED);
        clock.advanceSeconds(60);
        pool.updateStatus(newer.getKeyId(), KeyStatus.DISABLED);

        SelectedKey selected = pool.selectKey(Set.of());

        assertThat(selected.getKeyId()).isEqualTo(older.getKeyId());
        assertThat(selected.isFallback()).isTrue();
    }

    @Test
    @DisplayName("全部耗尽或删除时抛出 NoEligibleKeyException")
    void throwsWhenNothingEligible() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        ApiKeyEntity b = pool.addKey("tvly-bbb");
        pool.recordOutcome(a.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);
        pool.deleteKey(b.getKeyId());

        assertThatThrownBy(() -> pool.selectKey(Set.of()))
                .isInstanceOf(NoEligibleKeyException.class);
    }

    @Test
    @DisplayName("配额耗尽信号把 Key 标记为 exhausted 并计数")
    void quotaExhaustedMarksKey() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");

        pool.recordOutcome(a.getKeyId(), ResultStatus.SUCCESS);
        pool.recordOutcome(a.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);

        ApiKeyEntity after = pool.findKey(a.getKeyId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(KeyStatus.EXHAUSTED);
        assertThat(after.getTotalRequests()).isEqualTo(2);
        assertThat(after.getSuccessCount()).isEqualTo(1);
        assertThat(after.getQuotaExhaustedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("重新添加已删除的密钥保留原标识和计数")
    void reAddRestoresSoftDeletedKey() {
        ApiKeyEntity original = pool.addKey("tvly-aaa");
        pool.recordOutcome(original.getKeyId(), ResultStatus.SUCCESS);
        pool.deleteKey(original.getKeyId());

        ApiKeyEntity restored = pool.addKey("  tvly-aaa ");

        assertThat(restored.getKeyId()).isEqualTo(original.getKeyId());
        assertThat(restored.getId()).isEqualTo(original.getId());
        assertThat(restored.getStatus()).isEqualTo(KeyStatus.ACTIVE);
        assertThat(restored.getDeletedAt()).isNull();
        assertThat(restored.getSuccessCount()).isEqualTo(1);
        assertThat(pool.listKeys(true)).hasSize(1);
    }

    @Test
    @DisplayName("批量添加跳过已存在的密钥")
    void addKeysSkipsExisting() {
        pool.addKey("tvly-aaa");

        int changed = pool.addKeys(List.of("tvly-aaa", "tvly-bbb", " ", "tvly-ccc"));

        assertThat(changed).isEqualTo(2);
        assertThat(pool.listKeys(false)).hasSize(3);
    }

    @Test
    @DisplayName("只能手动设为 active 或 disabled")
    void rejectsManualExhausted() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");

        assertThatThrownBy(() -> pool.updateStatus(a.getKeyId(), KeyStatus.EXHAUSTED))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("月度重置只恢复上月之前耗尽的 Key")
    void rolloverRestoresKeysExhaustedBeforeMonthStart() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        pool.recordOutcome(a.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);
        long exhaustedAt = clock.epochSecond();

        assertThat(pool.rolloverExhausted(exhaustedAt)).isZero();

        clock.set(Instant.parse("2025-04-01T00:00:05Z"));
        int restored = pool.rolloverExhausted(Instant.parse("2025-04-01T00:00:00Z").getEpochSecond());

        assertThat(restored).isEqualTo(1);
        assertThat(pool.findKey(a.getKeyId()).orElseThrow().getStatus()).isEqualTo(KeyStatus.ACTIVE);
    }

    @Test
    @DisplayName("较旧的配额快照不会覆盖已有数据")
    void staleSnapshotIsIgnored() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");

        boolean first = pool.applyQuotaSnapshot(a.getKeyId(), new UsageSnapshot(1000L, 600L, 200L));
        boolean replay = pool.applyQuotaSnapshot(a.getKeyId(), new UsageSnapshot(1000L, 600L, 200L));
        boolean older = pool.applyQuotaSnapshot(a.getKeyId(), new UsageSnapshot(1000L, 900L, 100L));

        assertThat(first).isTrue();
        assertThat(replay).isFalse();
        assertThat(older).isFalse();
        assertThat(pool.findKey(a.getKeyId()).orElseThrow().getQuotaRemaining()).isEqualTo(600L);
        assertThat(pool.stats().getTotalQuotaRemaining()).isEqualTo(600L);
    }

    @Test
    @DisplayName("删除再恢复耗尽的 Key 仍是 exhausted，直到月度重置")
    void restoreKeepsExhaustedUntilRollover() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        ApiKeyEntity b = pool.addKey("tvly-bbb");
        pool.recordOutcome(a.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);
        long exhaustedAt = pool.findKey(a.getKeyId()).orElseThrow().getStatusChangedAt();

        clock.advanceSeconds(60);
        pool.deleteKey(a.getKeyId());
        assertThat(pool.findKey(a.getKeyId()).orElseThrow().getStatus()).isEqualTo(KeyStatus.DELETED);
        clock.advanceSeconds(60);
        pool.restoreKey(a.getKeyId());

        ApiKeyEntity restored = pool.findKey(a.getKeyId()).orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(KeyStatus.EXHAUSTED);
        assertThat(restored.getStatusChangedAt()).isEqualTo(exhaustedAt);
        assertThat(restored.getDeletedAt()).isNull();
        assertThat(pool.selectKey(Set.of()).getKeyId()).isEqualTo(b.getKeyId());
        assertThatThrownBy(() -> pool.selectKey(Set.of(b.getKeyId())))
                .isInstanceOf(NoEligibleKeyException.class);

        clock.set(Instant.parse("2025-04-01T00:00:05Z"));
        assertThat(pool.rolloverExhausted(Instant.parse("2025-04-01T00:00:00Z").getEpochSecond())).isEqualTo(1);
        assertThat(pool.findKey(a.getKeyId()).orElseThrow().getStatus()).isEqualTo(KeyStatus.ACTIVE);
    }

    @Test
    @DisplayName("删除再恢复禁用的 Key 仍是 disabled")
    void restoreKeepsDisabled() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        pool.updateStatus(a.getKeyId(), KeyStatus.DISABLED);

        pool.deleteKey(a.getKeyId());
        pool.restoreKey(a.getKeyId());

        assertThat(pool.findKey(a.getKeyId()).orElseThrow().getStatus()).isEqualTo(KeyStatus.DISABLED);
    }

    @Test
    @DisplayName("重新添加已删除的耗尽 Key 会重新启用")
    void reAddReactivatesDeletedExhaustedKey() {
        ApiKeyEntity a = pool.addKey("tvly-aaa");
        pool.recordOutcome(a.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);
        pool.deleteKey(a.getKeyId());

        ApiKeyEntity readded = pool.addKey("tvly-aaa");

        assertThat(readded.getStatus()).isEqualTo(KeyStatus.ACTIVE);
        assertThat(readded.getStatusBeforeDelete()).isNull();
    }

    @Test
    @DisplayName("兜底选中的禁用 Key 收到配额耗尽后保持禁用，月度重置也不启用")
    void fallbackDisabledKeyStaysDisabledOnQuotaExhausted() {
        ApiKeyEntity older = pool.addKey("tvly-old");
        ApiKeyEntity newer = pool.addKey("tvly-new");
        pool.updateStatus(older.getKeyId(), KeyStatus.DISABLED);
        clock.advanceSeconds(60);
        pool.updateStatus(newer.getKeyId(), KeyStatus.DISABLED);
        clock.advanceSeconds(60);

        SelectedKey selected = pool.selectKey(Set.of());
        assertThat(selected.getKeyId()).isEqualTo(older.getKeyId());
        pool.recordOutcome(selected.getKeyId(), ResultStatus.QUOTA_EXHAUSTED);

        ApiKeyEntity after = pool.findKey(older.getKeyId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(KeyStatus.DISABLED);
        assertThat(after.getStatusChangedAt()).isEqualTo(clock.epochSecond());
        assertThat(after.getQuotaExhaustedCount()).isEqualTo(1);
        assertThat(pool.selectKey(Set.of()).getKeyId()).isEqualTo(newer.getKeyId());

        clock.set(Instant.parse("2025-04-01T00:00:05Z"));
        assertThat(pool.rolloverExhausted(Instant.parse("2025-04-01T00:00:00Z").getEpochSecond())).isZero();
        assertThat(pool.findKey(older.getKeyId()).orElseThrow().getStatus()).isEqualTo(KeyStatus.DISABLED);
    }

    @Test
    @DisplayName("并发选 Key 时 N 个请求拿到 N 个不同的 Key")
    void concurrentSelectionsGetDistinctKeys() throws Exception {
        int n = 8;
        for (int i = 0; i < n; i++) {
            pool.addKey("tvly-key-" + i);
        }
        ExecutorService executor = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return pool.selectKey(Set.of()).getKeyId();
                }));
            }
            start.countDown();
            Set<String> selected = new HashSet<>();
            for (Future<String> future : futures) {
                selected.add(future.get(5, TimeUnit.SECONDS));
            }
            assertThat(selected).hasSize(n);
        } finally {
            executor.shutdownNow();
        }
    }
}

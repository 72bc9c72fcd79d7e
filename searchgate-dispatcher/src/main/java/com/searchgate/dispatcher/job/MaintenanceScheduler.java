package com.searchgate.dispatcher.job;

import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 定时把维护任务放入任务队列，实际执行由 {@link JobRunner} 完成。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final JobRunner jobRunner;
    private final ApiKeyPool keyPool;
    private final DispatcherProperties properties;
    private final Clock clock;

    /**
     * 为配额过期（默认 24 小时未同步）的 Key 各排一个同步任务。
     */
    @Scheduled(initialDelay = 30_000, fixedDelayString = "${searchgate.dispatcher.quota-sync-interval-ms:3600000}")
    public void scheduleQuotaSync() {
        long staleBefore = clock.instant().getEpochSecond() - properties.getQuotaSyncStaleHours() * 3600L;
        List<String> stale = keyPool.keysNeedingSync(staleBefore);
        int queued = 0;
        for (String keyId : stale) {
            if (jobRunner.enqueueIfAbsent(JobTypes.QUOTA_SYNC, keyId).isPresent()) {
                queued++;
            }
        }
        if (queued > 0) {
            log.info("配额同步: {} 个 Key 待同步, 新入队 {} 个", stale.size(), queued);
        }
    }

    @Scheduled(initialDelay = 60_000, fixedDelayString = "${searchgate.dispatcher.usage-rollup-interval-ms:300000}")
    public void scheduleUsageRollup() {
        jobRunner.enqueueIfAbsent(JobTypes.USAGE_ROLLUP, null);
    }

    @Scheduled(initialDelay = 120_000, fixedDelayString = "${searchgate.dispatcher.log-gc-interval-ms:3600000}")
    public void scheduleLogGc() {
        jobRunner.enqueueIfAbsent(JobTypes.LOG_GC, null);
    }

    @Scheduled(initialDelay = 10_000, fixedDelayString = "${searchgate.dispatcher.quota-rollover-interval-ms:3600000}")
    public void scheduleQuotaRollover() {
        jobRunner.enqueueIfAbsent(JobTypes.QUOTA_ROLLOVER, null);
    }
}

package com.searchgate.dispatcher.job;

import com.searchgate.data.entity.JobEntity;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.quota.QuotaCalendar;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 月度重置：本月开始之前耗尽的 Key 恢复为 active。
 */
@Component
@RequiredArgsConstructor
public class QuotaRolloverJobHandler implements JobHandler {

    private final ApiKeyPool keyPool;
    private final SnapshotBroadcaster broadcaster;
    private final DispatcherProperties properties;
    private final Clock clock;

    @Override
    public boolean supports(String jobType) {
        return JobTypes.QUOTA_ROLLOVER.equals(jobType);
    }

    @Override
    public String execute(JobEntity job) {
        long monthStart = QuotaCalendar.monthStart(clock.instant().getEpochSecond(), properties.zoneId());
        int restored = keyPool.rolloverExhausted(monthStart);
        if (restored > 0) {
            broadcaster.markDirty();
        }
        return "恢复 Key " + restored + " 个";
    }
}

package com.searchgate.dispatcher.job;

import com.searchgate.data.entity.JobEntity;
import com.searchgate.data.repository.JobRepository;
import com.searchgate.data.repository.RequestLogRepository;
import com.searchgate.data.repository.TokenQuotaHitRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.quota.QuotaCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 清理超过保留期的审计日志和已结束的任务记录，以及上个自然月之前的配额占用记录。
 */
@Component
@RequiredArgsConstructor
public class LogGcJobHandler implements JobHandler {

    private static final long DAY = 86400;

    private final RequestLogRepository logRepository;
    private final TokenQuotaHitRepository hitRepository;
    private final JobRepository jobRepository;
    private final DispatcherProperties properties;
    private final Clock clock;

    @Override
    public boolean supports(String jobType) {
        return JobTypes.LOG_GC.equals(jobType);
    }

    @Override
    public String execute(JobEntity job) {
        long now = clock.instant().getEpochSecond();
        long logCutoff = now - properties.getLogRetentionDays() * DAY;
        long hitCutoff = QuotaCalendar.previousMonthStart(now, properties.zoneId());
        int logs = logRepository.deleteOlderThan(logCutoff);
        int hits = hitRepository.deleteOlderThan(hitCutoff);
        int jobs = jobRepository.deleteFinishedBefore(logCutoff);
        return "删除日志 " + logs + " 条, 配额占用记录 " + hits + " 条, 任务记录 " + jobs + " 条";
    }
}

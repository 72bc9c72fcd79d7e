package com.searchgate.dispatcher.job;

import com.searchgate.common.dto.PageResult;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.data.entity.JobEntity;
import com.searchgate.data.entity.JobStatus;
import com.searchgate.data.repository.JobRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 后台任务执行器。
 * <p>
 * 任务先以 QUEUED 状态落库，定时扫描领取到期任务（置为 RUNNING、尝试次数加一）后交给独立线程池执行。
 * 失败时按 {@code base * 2^(attempt-1)} 退避重新排队，达到最大尝试次数后标记为 FAILED，不再自动重试。
 */
@Slf4j
@Service
public class JobRunner {

    private static final int MAX_PER_PAGE = 200;
    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final JobRepository repository;
    private final List<JobHandler> handlers;
    private final DispatcherProperties properties;
    private final Clock clock;
    private final Executor jobExecutor;

    public JobRunner(JobRepository repository, List<JobHandler> handlers, DispatcherProperties properties,
                     Clock clock, @Qualifier("jobExecutor") Executor jobExecutor) {
        this.repository = repository;
        this.handlers = handlers;
        this.properties = properties;
        this.clock = clock;
        this.jobExecutor = jobExecutor;
    }

    /**
     * 上次进程退出时仍在执行的任务重新排队。
     */
    @PostConstruct
    public void requeueInterrupted() {
        List<JobEntity> running = repository.findRunning();
        for (JobEntity job : running) {
            job.setStatus(JobStatus.QUEUED);
            job.setNextRunAt(now());
            job.setMessage("进程重启，重新排队");
            repository.save(job);
        }
        if (!running.isEmpty()) {
            log.warn("重新排队 {} 个中断的任务", running.size());
        }
    }

    public JobView enqueue(String jobType, String keyId) {
        if (findHandler(jobType).isEmpty()) {
            throw new InvalidRequestException("未知的任务类型: " + jobType);
        }
        long now = now();
        JobEntity job = repository.save(JobEntity.builder()
                .jobType(jobType)
                .keyId(keyId)
                .status(JobStatus.QUEUED)
                .attempt(0)
                .maxAttempts(Math.max(1, properties.getJobMaxAttempts()))
                .createdAt(now)
                .nextRunAt(now)
                .build());
        log.info("任务入队: #{} {}{}", job.getId(), jobType, keyId == null ? "" : " key=" + keyId);
        return JobView.of(job);
    }

    /**
     * 同类型同目标已有未结束的任务时不重复入队。
     */
    public Optional<JobView> enqueueIfAbsent(String jobType, String keyId) {
        if (repository.countPending(jobType, keyId) > 0) {
            log.debug("任务 {} (key={}) 已在队列中，跳过", jobType, keyId);
            return Optional.empty();
        }
        return Optional.of(enqueue(jobType, keyId));
    }

    /**
     * 领取到期任务并提交执行。
     */
    @Scheduled(fixedDelayString = "${searchgate.dispatcher.job-poll-interval-ms:1000}")
    public synchronized void poll() {
        List<JobEntity> due = repository.findDue(now(), Math.max(1, properties.getJobBatchSize()));
        for (JobEntity job : due) {
            job.setStatus(JobStatus.RUNNING);
            job.setAttempt(job.getAttempt() + 1);
            job.setStartedAt(now());
            JobEntity claimed = repository.save(job);
            try {
                jobExecutor.execute(() -> run(claimed));
            } catch (RejectedExecutionException e) {
                log.warn("任务 #{} 提交失败，稍后重试", claimed.getId());
                claimed.setStatus(JobStatus.QUEUED);
                claimed.setAttempt(claimed.getAttempt() - 1);
                repository.save(claimed);
            }
        }
    }

    void run(JobEntity job) {
        try {
            runAttempt(job);
        } catch (DataAccessException e) {
            log.error("任务 #{} {} 状态写入失败", job.getId(), job.getJobType(), e);
            markStateLost(job, e);
        }
    }

    private void runAttempt(JobEntity job) {
        Optional<JobHandler> handler = findHandler(job.getJobType());
        if (handler.isEmpty()) {
            finish(job, JobStatus.FAILED, "没有处理器: " + job.getJobType());
            return;
        }
        log.info("开始执行任务 #{} {} (第 {}/{} 次)", job.getId(), job.getJobType(),
                job.getAttempt(), job.getMaxAttempts());
        String message;
        try {
            message = handler.get().execute(job);
        } catch (RuntimeException e) {
            onFailure(job, e);
            return;
        }
        finish(job, JobStatus.SUCCEEDED, message);
        log.info("任务 #{} {} 完成: {}", job.getId(), job.getJobType(), message);
    }

    private void onFailure(JobEntity job, RuntimeException e) {
        if (job.getAttempt() >= job.getMaxAttempts()) {
            finish(job, JobStatus.FAILED, "第 " + job.getAttempt() + " 次尝试失败，不再重试: " + e.getMessage());
            log.error("任务 #{} {} 最终失败", job.getId(), job.getJobType(), e);
            return;
        }
        long delay = backoffSeconds(job.getAttempt());
        job.setStatus(JobStatus.QUEUED);
        job.setNextRunAt(now() + delay);
        job.setMessage(truncate("第 " + job.getAttempt() + " 次尝试失败，" + delay + " 秒后重试: " + e.getMessage()));
        repository.save(job);
        log.warn("任务 #{} {} 第 {} 次失败，{} 秒后重试: {}", job.getId(), job.getJobType(),
                job.getAttempt(), delay, e.getMessage());
    }

    /**
     * 结果没能落库时再写一次 FAILED，让任务不至于一直停在 running；仍失败则只能等重启时重新排队。
     */
    private void markStateLost(JobEntity job, DataAccessException cause) {
        job.setStatus(JobStatus.FAILED);
        job.setFinishedAt(now());
        job.setMessage(truncate("任务状态写入失败，需要人工重新入队: " + cause.getMessage()));
        try {
            repository.save(job);
        } catch (DataAccessException e) {
            log.error("任务 #{} 仍停留在 running，下次启动时重新排队", job.getId(), e);
        }
    }

    /**
     * 第 attempt 次失败后的等待时间。
     */
    public long backoffSeconds(int attempt) {
        long base = Math.max(1, properties.getJobBackoffBaseSeconds());
        int shift = Math.min(Math.max(0, attempt - 1), 30);
        return Math.min(properties.getJobBackoffMaxSeconds(), base << shift);
    }

    public PageResult<JobView> list(String group, int page, int perPage) {
        int size = perPage <= 0 ? 20 : Math.min(MAX_PER_PAGE, perPage);
        int p = Math.max(1, page);
        String pattern = JobTypes.groupPattern(group);
        List<JobView> items = repository.findPage(pattern, size, (long) (p - 1) * size)
                .stream().map(JobView::of).collect(Collectors.toList());
        return PageResult.of(items, repository.countByPattern(pattern), p, size);
    }

    public JobView get(long id) {
        return repository.findById(id).map(JobView::of)
                .orElseThrow(() -> new NotFoundException("任务不存在: " + id));
    }

    private void finish(JobEntity job, JobStatus status, String message) {
        job.setStatus(status);
        job.setFinishedAt(now());
        job.setMessage(truncate(message));
        repository.save(job);
    }

    private Optional<JobHandler> findHandler(String jobType) {
        return handlers.stream().filter(h -> h.supports(jobType)).findFirst();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

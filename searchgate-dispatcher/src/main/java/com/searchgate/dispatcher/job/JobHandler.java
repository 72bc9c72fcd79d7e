package com.searchgate.dispatcher.job;

import com.searchgate.data.entity.JobEntity;

/**
 * 后台任务处理器。抛出异常即视为本次尝试失败，由 {@link JobRunner} 按策略重试。
 */
public interface JobHandler {

    boolean supports(String jobType);

    /**
     * 执行一次任务，返回写入任务记录的结果说明。
     * 实现必须幂等：同一任务重复执行不能重复计数。
     */
    String execute(JobEntity job);
}

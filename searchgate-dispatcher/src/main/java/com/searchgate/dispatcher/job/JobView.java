package com.searchgate.dispatcher.job;

import com.searchgate.data.entity.JobEntity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class JobView {

    long id;
    String jobType;
    String keyId;
    String status;
    boolean finished;
    int attempt;
    int maxAttempts;
    String message;
    Long createdAt;
    Long nextRunAt;
    Long startedAt;
    Long finishedAt;

    public static JobView of(JobEntity job) {
        return JobView.builder()
                .id(job.getId())
                .jobType(job.getJobType())
                .keyId(job.getKeyId())
                .status(job.getStatus().wireName())
                .finished(job.getStatus().isTerminal())
                .attempt(job.getAttempt())
                .maxAttempts(job.getMaxAttempts())
                .message(job.getMessage())
                .createdAt(job.getCreatedAt())
                .nextRunAt(job.getNextRunAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }
}

package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 后台任务记录。
 */
@Table("t_job")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEntity {

    @Id
    private Long id;

    private String jobType;

    private String keyId;

    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    @Builder.Default
    private Integer attempt = 0;

    @Builder.Default
    private Integer maxAttempts = 3;

    private String message;

    private Long createdAt;

    /** 下次可执行时间，退避重试时推后 */
    private Long nextRunAt;

    private Long startedAt;

    private Long finishedAt;
}

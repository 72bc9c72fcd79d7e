package com.searchgate.upstream.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 上游返回的某个 Key 的配额快照。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageSnapshot {

    private long limit;

    private long remaining;

    /** 拉取时间（epoch 秒） */
    private long fetchedAt;
}

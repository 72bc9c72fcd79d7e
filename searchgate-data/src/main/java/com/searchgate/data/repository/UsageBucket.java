package com.searchgate.data.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按时间桶聚合的调用计数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageBucket {

    private long bucketStart;
    private long successCount;
    /** 网关自身或上游故障 */
    private long systemFailureCount;
    /** 配额耗尽等外部原因 */
    private long externalFailureCount;
}

package com.searchgate.dispatcher.job;

import com.searchgate.common.exception.NotFoundException;
import com.searchgate.data.entity.ApiKeyEntity;
import com.searchgate.data.entity.JobEntity;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.upstream.model.UsageSnapshot;
import com.searchgate.upstream.provider.UpstreamProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 同步单个 Key 的上游真实配额。
 * <p>
 * 先读出密钥，在锁外调用上游，再把快照交给 Key 池应用；快照不比本地新时不修改任何字段。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuotaSyncJobHandler implements JobHandler {

    private final ApiKeyPool keyPool;
    private final UpstreamProvider provider;
    private final SnapshotBroadcaster broadcaster;

    @Override
    public boolean supports(String jobType) {
        return JobTypes.QUOTA_SYNC.equals(jobType) || JobTypes.QUOTA_SYNC_MANUAL.equals(jobType);
    }

    @Override
    public String execute(JobEntity job) {
        String keyId = job.getKeyId();
        ApiKeyEntity key = keyPool.findKey(keyId)
                .orElseThrow(() -> new NotFoundException("Key 不存在: " + keyId));
        if (key.getStatus() == KeyStatus.DELETED) {
            return "Key 已删除，跳过";
        }

        UsageSnapshot snapshot = provider.fetchUsage(key.getSecret());
        boolean changed = keyPool.applyQuotaSnapshot(keyId, snapshot);
        if (changed) {
            broadcaster.markDirty();
        }
        String message = "limit=" + snapshot.getLimit() + ", remaining=" + snapshot.getRemaining();
        return changed ? message : message + "（无变化）";
    }
}

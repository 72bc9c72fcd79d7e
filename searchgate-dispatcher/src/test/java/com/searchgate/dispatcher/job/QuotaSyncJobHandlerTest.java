package com.searchgate.dispatcher.job;

import com.searchgate.common.exception.UsageSyncException;
import com.searchgate.data.entity.ApiKeyEntity;
import com.searchgate.data.entity.JobEntity;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.upstream.model.UsageSnapshot;
import com.searchgate.upstream.provider.UpstreamProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuotaSyncJobHandler")
class QuotaSyncJobHandlerTest {

    @Mock
    private ApiKeyPool keyPool;

    @Mock
    private UpstreamProvider provider;

    @Mock
    private SnapshotBroadcaster broadcaster;

    @InjectMocks
    private QuotaSyncJobHandler handler;

    private static JobEntity job() {
        return JobEntity.builder().id(3L).jobType(JobTypes.QUOTA_SYNC_MANUAL).keyId("k001").build();
    }

    private static ApiKeyEntity key(KeyStatus status) {
        return ApiKeyEntity.builder().keyId("k001").secret("tvly-secret").status(status).build();
    }

    @Test
    @DisplayName("支持定时与手动两种同步任务")
    void supportsBothSyncTypes() {
        assertThat(handler.supports(JobTypes.QUOTA_SYNC)).isTrue();
        assertThat(handler.supports(JobTypes.QUOTA_SYNC_MANUAL)).isTrue();
        assertThat(handler.supports(JobTypes.LOG_GC)).isFalse();
    }

    @Test
    @DisplayName("重复执行同一快照时第二次不产生变化")
    void repeatedSyncIsIdempotent() {
        UsageSnapshot snapshot = new UsageSnapshot(1000, 750, 1_700_000_000L);
        when(keyPool.findKey("k001")).thenReturn(Optional.of(key(KeyStatus.ACTIVE)));
        when(provider.fetchUsage("tvly-secret")).thenReturn(snapshot);
        when(keyPool.applyQuotaSnapshot("k001", snapshot)).thenReturn(true, false);

        String first = handler.execute(job());
        String second = handler.execute(job());

        assertThat(first).isEqualTo("limit=1000, remaining=750");
        assertThat(second).endsWith("（无变化）");
        verify(broadcaster, times(1)).markDirty();
    }

    @Test
    @DisplayName("已删除的 Key 不调用上游")
    void deletedKeyIsSkipped() {
        when(keyPool.findKey("k001")).thenReturn(Optional.of(key(KeyStatus.DELETED)));

        assertThat(handler.execute(job())).contains("跳过");
        verify(provider, never()).fetchUsage(anyString());
    }

    @Test
    @DisplayName("上游失败时不修改本地配额并向上抛出以便重试")
    void upstreamFailurePropagates() {
        when(keyPool.findKey("k001")).thenReturn(Optional.of(key(KeyStatus.EXHAUSTED)));
        when(provider.fetchUsage("tvly-secret"))
                .thenThrow(new UsageSyncException(UsageSyncException.Reason.QUOTA_DATA_MISSING, 200, "缺少配额字段"));

        assertThatThrownBy(() -> handler.execute(job())).isInstanceOf(UsageSyncException.class);
        verify(keyPool, never()).applyQuotaSnapshot(anyString(), any());
    }
}

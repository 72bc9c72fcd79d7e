package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.audit.LogView;
import com.searchgate.dispatcher.job.JobRunner;
import com.searchgate.dispatcher.job.JobTypes;
import com.searchgate.dispatcher.job.JobView;
import com.searchgate.dispatcher.metrics.RequestStats;
import com.searchgate.dispatcher.metrics.UsageMetricsService;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.pool.KeyView;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.web.dto.AddKeyRequest;
import com.searchgate.web.dto.BatchAddKeysRequest;
import com.searchgate.web.dto.SecretResponse;
import com.searchgate.web.dto.StatusRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 上游 Key 管理（仅管理员）。
 */
@RestController
@RequestMapping("/api/keys")
@RequiredArgsConstructor
public class KeyController {

    private final ApiKeyPool keyPool;
    private final JobRunner jobRunner;
    private final UsageMetricsService metricsService;
    private final AuditLogService auditLogService;
    private final SnapshotBroadcaster broadcaster;

    @GetMapping
    public ApiResponse<List<KeyView>> list(
            @RequestParam(value = "include_deleted", defaultValue = "false") boolean includeDeleted) {
        return ApiResponse.ok(keyPool.listKeys(includeDeleted).stream().map(KeyView::of).collect(Collectors.toList()));
    }

    /**
     * 添加 Key；同一密钥此前被删除过时恢复原标识和计数。
     */
    @PostMapping
    public ApiResponse<KeyView> add(@RequestBody AddKeyRequest request) {
        KeyView view = KeyView.of(keyPool.addKey(request.getApiKey()));
        broadcaster.markDirty();
        return ApiResponse.ok(view);
    }

    @PostMapping("/batch")
    public ApiResponse<Integer> addBatch(@RequestBody BatchAddKeysRequest request) {
        int changed = keyPool.addKeys(request.getApiKeys());
        broadcaster.markDirty();
        return ApiResponse.ok(changed);
    }

    @GetMapping("/{id}")
    public ApiResponse<KeyView> detail(@PathVariable("id") String id) {
        return ApiResponse.ok(keyPool.findKey(id).map(KeyView::of)
                .orElseThrow(() -> new NotFoundException("Key 不存在: " + id)));
    }

    @GetMapping("/{id}/secret")
    public ApiResponse<SecretResponse> secret(@PathVariable("id") String id) {
        return ApiResponse.ok(new SecretResponse(id, keyPool.revealSecret(id)));
    }

    /** 软删除 */
    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String id) {
        keyPool.deleteKey(id);
        broadcaster.markDirty();
        return ApiResponse.ok(null, "已删除");
    }

    @PostMapping("/{id}/restore")
    public ApiResponse<Void> restore(@PathVariable("id") String id) {
        keyPool.restoreKey(id);
        broadcaster.markDirty();
        return ApiResponse.ok(null, "已恢复");
    }

    @PatchMapping("/{id}/status")
    public ApiResponse<KeyView> updateStatus(@PathVariable("id") String id, @RequestBody StatusRequest request) {
        KeyStatus target;
        if ("active".equalsIgnoreCase(request.getStatus())) {
            target = KeyStatus.ACTIVE;
        } else if ("disabled".equalsIgnoreCase(request.getStatus())) {
            target = KeyStatus.DISABLED;
        } else {
            throw new InvalidRequestException("status 只能是 active 或 disabled");
        }
        keyPool.updateStatus(id, target);
        broadcaster.markDirty();
        return detail(id);
    }

    /**
     * 手动同步该 Key 的上游配额（异步任务）。
     */
    @PostMapping("/{id}/sync-usage")
    public ApiResponse<JobView> syncUsage(@PathVariable("id") String id) {
        if (keyPool.findKey(id).isEmpty()) {
            throw new NotFoundException("Key 不存在: " + id);
        }
        return ApiResponse.ok(jobRunner.enqueue(JobTypes.QUOTA_SYNC_MANUAL, id));
    }

    @GetMapping("/{id}/metrics")
    public ApiResponse<RequestStats> metrics(@PathVariable("id") String id,
                                             @RequestParam(value = "period", required = false) String period,
                                             @RequestParam(value = "since", required = false) Long since) {
        return ApiResponse.ok(metricsService.keyMetrics(id, since, period));
    }

    @GetMapping("/{id}/logs")
    public ApiResponse<List<LogView>> logs(@PathVariable("id") String id,
                                           @RequestParam(value = "limit", defaultValue = "50") int limit,
                                           @RequestParam(value = "since", required = false) Long since) {
        int n = Math.max(1, Math.min(AuditLogService.MAX_PER_PAGE, limit));
        return ApiResponse.ok(auditLogService.recent(
                RequestLogFilter.builder().keyId(id).since(since).build(), n));
    }
}

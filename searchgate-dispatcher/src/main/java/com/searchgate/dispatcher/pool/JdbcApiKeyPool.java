package com.searchgate.dispatcher.pool;

import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NoEligibleKeyException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.common.util.IdGenerator;
import com.searchgate.common.util.SensitiveDataRedactor;
import com.searchgate.data.entity.ApiKeyEntity;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.data.repository.ApiKeyRepository;
import com.searchgate.upstream.model.UsageSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 基于 SQLite 的 Key 池。
 * <p>
 * 启动时把整张表读入内存，之后所有读写都在同一把锁内完成并立即写回数据库
 * （先改副本、落库成功后再替换缓存）。锁内不做任何网络调用。
 */
@Slf4j
@Component
public class JdbcApiKeyPool implements ApiKeyPool {

    private static final int KEY_ID_LENGTH = 4;

    /** 最久未使用优先，同时间按标识排序 */
    private static final Comparator<ApiKeyEntity> LRU_ORDER =
            Comparator.<ApiKeyEntity>comparingLong(k -> nz(k.getLastUsedAt()))
                    .thenComparing(ApiKeyEntity::getKeyId);

    /** 禁用最久优先 */
    private static final Comparator<ApiKeyEntity> LONGEST_DISABLED_ORDER =
            Comparator.<ApiKeyEntity>comparingLong(k -> nz(k.getStatusChangedAt()))
                    .thenComparing(ApiKeyEntity::getKeyId);

    private final ApiKeyRepository repository;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    /** keyId -> 行，受 lock 保护 */
    private final Map<String, ApiKeyEntity> keys = new LinkedHashMap<>();

    public JdbcApiKeyPool(ApiKeyRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        lock.lock();
        try {
            keys.clear();
            for (ApiKeyEntity entity : repository.findAllOrdered()) {
                keys.put(entity.getKeyId(), entity);
            }
            log.info("Key 池加载完成, 共 {} 个 Key", keys.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SelectedKey selectKey(Set<String> excludedKeyIds) {
        lock.lock();
        try {
            boolean fallback = false;
            ApiKeyEntity chosen = pick(KeyStatus.ACTIVE, LRU_ORDER, excludedKeyIds);
            if (chosen == null) {
                chosen = pick(KeyStatus.DISABLED, LONGEST_DISABLED_ORDER, excludedKeyIds);
                fallback = chosen != null;
            }
            if (chosen == null) {
                throw new NoEligibleKeyException("没有可用的上游 Key（全部耗尽、禁用或删除）");
            }

            ApiKeyEntity updated = copy(chosen);
            updated.setLastUsedAt(now());
            persist(updated);

            if (fallback) {
                log.warn("没有 active Key，临时使用禁用最久的 Key: {}", updated.getKeyId());
            } else {
                log.debug("选中 Key: {}", updated.getKeyId());
            }
            return new SelectedKey(updated.getKeyId(), updated.getSecret(), fallback);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordOutcome(String keyId, ResultStatus result) {
        lock.lock();
        try {
            ApiKeyEntity current = keys.get(keyId);
            if (current == null) {
                log.warn("记录调用结果时 Key 不存在: {}", keyId);
                return;
            }
            ApiKeyEntity updated = copy(current);
            updated.setTotalRequests(nz(updated.getTotalRequests()) + 1);
            switch (result) {
                case SUCCESS:
                    updated.setSuccessCount(nz(updated.getSuccessCount()) + 1);
                    break;
                case QUOTA_EXHAUSTED:
                    updated.setQuotaExhaustedCount(nz(updated.getQuotaExhaustedCount()) + 1);
                    if (updated.getStatus() == KeyStatus.DISABLED) {
                        // 兜底选中的禁用 Key：保持禁用，排到兜底队列末尾
                        updated.setStatusChangedAt(now());
                        log.warn("兜底使用的禁用 Key {} 上游配额耗尽，保持禁用", keyId);
                    } else if (transition(updated, KeyStatus.EXHAUSTED)) {
                        log.warn("Key {} 上游配额耗尽，停止调度直到月度重置", keyId);
                    }
                    break;
                default:
                    updated.setErrorCount(nz(updated.getErrorCount()) + 1);
                    break;
            }
            persist(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ApiKeyEntity addKey(String secret) {
        String trimmed = secret == null ? "" : secret.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException("Key 不能为空");
        }
        lock.lock();
        try {
            ApiKeyEntity existing = findBySecret(trimmed);
            if (existing != null) {
                if (existing.getStatus() != KeyStatus.DELETED) {
                    log.debug("Key 已存在: {}", existing.getKeyId());
                    return copy(existing);
                }
                ApiKeyEntity restored = copy(existing);
                transition(restored, KeyStatus.ACTIVE);
                restored.setDeletedAt(null);
                restored.setStatusBeforeDelete(null);
                persist(restored);
                log.info("重新添加已删除的 Key，恢复原标识: {}", restored.getKeyId());
                return copy(restored);
            }

            long now = now();
            ApiKeyEntity created = ApiKeyEntity.builder()
                    .keyId(newKeyId())
                    .secret(trimmed)
                    .status(KeyStatus.ACTIVE)
                    .statusChangedAt(now)
                    .createdAt(now)
                    .build();
            persist(created);
            log.info("添加新 Key: {} ({})", created.getKeyId(), SensitiveDataRedactor.maskKey(trimmed));
            return copy(created);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int addKeys(List<String> secrets) {
        int changed = 0;
        for (String secret : secrets) {
            if (secret == null || secret.isBlank()) {
                continue;
            }
            lock.lock();
            try {
                ApiKeyEntity existing = findBySecret(secret.trim());
                if (existing != null && existing.getStatus() != KeyStatus.DELETED) {
                    continue;
                }
                addKey(secret);
                changed++;
            } finally {
                lock.unlock();
            }
        }
        log.info("批量添加 Key 完成, 新增或恢复 {} 个", changed);
        return changed;
    }

    @Override
    public void deleteKey(String keyId) {
        lock.lock();
        try {
            ApiKeyEntity updated = copy(require(keyId));
            if (updated.getStatus() == KeyStatus.DELETED) {
                return;
            }
            // 只打删除标记，健康状态和 status_changed_at 留到恢复时还原
            updated.setStatusBeforeDelete(updated.getStatus());
            updated.setStatus(KeyStatus.DELETED);
            updated.setDeletedAt(now());
            persist(updated);
            log.info("软删除 Key: {} (原状态 {})", keyId, updated.getStatusBeforeDelete().wireName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void restoreKey(String keyId) {
        lock.lock();
        try {
            ApiKeyEntity updated = copy(require(keyId));
            if (updated.getStatus() != KeyStatus.DELETED) {
                return;
            }
            KeyStatus previous = updated.getStatusBeforeDelete() == null
                    ? KeyStatus.ACTIVE : updated.getStatusBeforeDelete();
            updated.setStatus(previous);
            updated.setStatusBeforeDelete(null);
            updated.setDeletedAt(null);
            persist(updated);
            log.info("恢复 Key: {} -> {}", keyId, previous.wireName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateStatus(String keyId, KeyStatus target) {
        if (target != KeyStatus.ACTIVE && target != KeyStatus.DISABLED) {
            throw new InvalidRequestException("只能把 Key 设为 active 或 disabled");
        }
        lock.lock();
        try {
            ApiKeyEntity updated = copy(require(keyId));
            if (updated.getStatus() == target) {
                return;
            }
            if (updated.getStatus() == KeyStatus.DELETED) {
                throw new InvalidRequestException("Key 已删除，请先恢复: " + keyId);
            }
            transition(updated, target);
            persist(updated);
            log.info("Key {} 状态更新为 {}", keyId, target.wireName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String revealSecret(String keyId) {
        lock.lock();
        try {
            return require(keyId).getSecret();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ApiKeyEntity> findKey(String keyId) {
        lock.lock();
        try {
            return Optional.ofNullable(keys.get(keyId)).map(JdbcApiKeyPool::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ApiKeyEntity> listKeys(boolean includeDeleted) {
        lock.lock();
        try {
            return keys.values().stream()
                    .filter(k -> includeDeleted || k.getStatus() != KeyStatus.DELETED)
                    .sorted(Comparator.comparing(ApiKeyEntity::getKeyId))
                    .map(JdbcApiKeyPool::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean applyQuotaSnapshot(String keyId, UsageSnapshot snapshot) {
        lock.lock();
        try {
            ApiKeyEntity current = keys.get(keyId);
            if (current == null) {
                log.warn("同步配额时 Key 不存在: {}", keyId);
                return false;
            }
            if (current.getQuotaSyncedAt() != null && snapshot.getFetchedAt() <= current.getQuotaSyncedAt()) {
                log.debug("Key {} 的配额快照不比已有数据新，忽略", keyId);
                return false;
            }
            ApiKeyEntity updated = copy(current);
            updated.setQuotaLimit(snapshot.getLimit());
            updated.setQuotaRemaining(snapshot.getRemaining());
            updated.setQuotaSyncedAt(snapshot.getFetchedAt());
            persist(updated);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int rolloverExhausted(long monthStart) {
        lock.lock();
        try {
            List<ApiKeyEntity> due = keys.values().stream()
                    .filter(k -> k.getStatus() == KeyStatus.EXHAUSTED && nz(k.getStatusChangedAt()) < monthStart)
                    .collect(Collectors.toList());
            for (ApiKeyEntity key : due) {
                ApiKeyEntity updated = copy(key);
                transition(updated, KeyStatus.ACTIVE);
                persist(updated);
            }
            if (!due.isEmpty()) {
                log.info("月度重置: {} 个耗尽的 Key 恢复为 active", due.size());
            }
            return due.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> keysNeedingSync(long staleBefore) {
        lock.lock();
        try {
            return keys.values().stream()
                    .filter(k -> k.getStatus() != KeyStatus.DELETED)
                    .filter(k -> k.getQuotaSyncedAt() == null || k.getQuotaSyncedAt() < staleBefore)
                    .map(ApiKeyEntity::getKeyId)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public KeyPoolStats stats() {
        lock.lock();
        try {
            long active = 0, exhausted = 0, disabled = 0, deleted = 0, limit = 0, remaining = 0;
            for (ApiKeyEntity key : keys.values()) {
                switch (key.getStatus()) {
                    case ACTIVE:
                        active++;
                        break;
                    case EXHAUSTED:
                        exhausted++;
                        break;
                    case DISABLED:
                        disabled++;
                        break;
                    default:
                        deleted++;
                        continue;
                }
                limit += nz(key.getQuotaLimit());
                remaining += nz(key.getQuotaRemaining());
            }
            return KeyPoolStats.builder()
                    .activeKeys(active)
                    .exhaustedKeys(exhausted)
                    .disabledKeys(disabled)
                    .deletedKeys(deleted)
                    .totalQuotaLimit(limit)
                    .totalQuotaRemaining(remaining)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 内部方法（调用方已持有锁） ====================

    private ApiKeyEntity pick(KeyStatus status, Comparator<ApiKeyEntity> order, Set<String> excluded) {
        return keys.values().stream()
                .filter(k -> k.getStatus() == status)
                .filter(k -> excluded == null || !excluded.contains(k.getKeyId()))
                .min(order)
                .orElse(null);
    }

    private boolean transition(ApiKeyEntity key, KeyStatus target) {
        if (key.getStatus() == target || !key.getStatus().canTransitionTo(target)) {
            return false;
        }
        key.setStatus(target);
        key.setStatusChangedAt(now());
        return true;
    }

    private void persist(ApiKeyEntity updated) {
        ApiKeyEntity saved = repository.save(updated);
        keys.put(saved.getKeyId(), saved);
    }

    private ApiKeyEntity require(String keyId) {
        ApiKeyEntity key = keys.get(keyId);
        if (key == null) {
            throw new NotFoundException("Key 不存在: " + keyId);
        }
        return key;
    }

    private ApiKeyEntity findBySecret(String secret) {
        for (ApiKeyEntity key : keys.values()) {
            if (key.getSecret().equals(secret)) {
                return key;
            }
        }
        return null;
    }

    private String newKeyId() {
        String id;
        do {
            id = IdGenerator.randomAlphanumeric(KEY_ID_LENGTH);
        } while (keys.containsKey(id));
        return id;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }

    static ApiKeyEntity copy(ApiKeyEntity k) {
        return new ApiKeyEntity(k.getId(), k.getKeyId(), k.getSecret(), k.getStatus(), k.getStatusChangedAt(),
                k.getLastUsedAt(), k.getDeletedAt(), k.getStatusBeforeDelete(), k.getQuotaLimit(), k.getQuotaRemaining(),
                k.getQuotaSyncedAt(), k.getTotalRequests(), k.getSuccessCount(), k.getErrorCount(),
                k.getQuotaExhaustedCount(), k.getCreatedAt());
    }
}

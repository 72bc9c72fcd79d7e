package com.searchgate.dispatcher.pool;

import com.searchgate.data.entity.ApiKeyEntity;
import com.searchgate.data.entity.KeyStatus;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.upstream.model.UsageSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 上游 Key 池：持有全部 Key 的生命周期状态，并按 LRU 公平策略选 Key。
 * <p>
 * 返回给调用方的实体均为副本，修改它们不会影响池内状态。
 */
public interface ApiKeyPool {

    /**
     * 选出最久未使用的 active Key，并原子地把它的 lastUsedAt 盖成当前时间。
     * 没有 active Key 时退回到禁用最久的 disabled Key。
     *
     * @param excludedKeyIds 本次请求已经试过的 Key
     * @throws com.searchgate.common.exception.NoEligibleKeyException 没有任何可选 Key
     */
    SelectedKey selectKey(Set<String> excludedKeyIds);

    /** 记录一次调用结果，配额耗尽时 Key 转为 exhausted */
    void recordOutcome(String keyId, ResultStatus result);

    /** 添加 Key；同一密钥已被软删除时恢复原记录 */
    ApiKeyEntity addKey(String secret);

    /** 批量添加，返回新增或恢复的数量 */
    int addKeys(List<String> secrets);

    void deleteKey(String keyId);

    void restoreKey(String keyId);

    /** 管理员启用 / 禁用 */
    void updateStatus(String keyId, KeyStatus target);

    String revealSecret(String keyId);

    Optional<ApiKeyEntity> findKey(String keyId);

    List<ApiKeyEntity> listKeys(boolean includeDeleted);

    /**
     * 应用上游配额快照。快照不比已有数据新时不做任何修改。
     *
     * @return 是否有字段被更新
     */
    boolean applyQuotaSnapshot(String keyId, UsageSnapshot snapshot);

    /** 把月初之前耗尽的 Key 恢复为 active，返回恢复数量 */
    int rolloverExhausted(long monthStart);

    /** 配额从未同步或同步时间早于 staleBefore 的未删除 Key */
    List<String> keysNeedingSync(long staleBefore);

    KeyPoolStats stats();
}

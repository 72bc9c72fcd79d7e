package com.searchgate.data.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 上游 Key 健康状态及其合法迁移表。
 * <p>
 * DELETED 只是软删除标记：管理员恢复时回到删除前的状态，重新添加同一密钥时回到 ACTIVE。
 * 被禁用的 Key 只能由管理员启用，配额耗尽信号和月度重置都不改变它。
 */
public enum KeyStatus {

    ACTIVE,
    EXHAUSTED,
    DISABLED,
    DELETED;

    public Set<KeyStatus> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(EXHAUSTED, DISABLED, DELETED);
            case EXHAUSTED:
                return EnumSet.of(ACTIVE, DISABLED, DELETED);
            case DISABLED:
                return EnumSet.of(ACTIVE, DELETED);
            case DELETED:
                return EnumSet.of(ACTIVE, EXHAUSTED, DISABLED);
            default:
                return EnumSet.noneOf(KeyStatus.class);
        }
    }

    public boolean canTransitionTo(KeyStatus target) {
        return allowedTargets().contains(target);
    }

    /** 对外展示用的小写名 */
    public String wireName() {
        return name().toLowerCase();
    }
}

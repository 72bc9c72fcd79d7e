package com.searchgate.data.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 访问令牌状态。与 Key 一致，删除只是软标记。
 */
public enum TokenStatus {

    ENABLED,
    DISABLED,
    DELETED;

    public Set<TokenStatus> allowedTargets() {
        switch (this) {
            case ENABLED:
                return EnumSet.of(DISABLED, DELETED);
            case DISABLED:
                return EnumSet.of(ENABLED, DELETED);
            default:
                return EnumSet.noneOf(TokenStatus.class);
        }
    }

    public boolean canTransitionTo(TokenStatus target) {
        return allowedTargets().contains(target);
    }
}

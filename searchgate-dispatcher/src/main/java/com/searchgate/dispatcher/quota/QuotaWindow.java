package com.searchgate.dispatcher.quota;

/**
 * 令牌配额窗口。声明顺序即严格程度从低到高：月度窗口恢复最慢，同时超限时优先报告。
 */
public enum QuotaWindow {

    HOUR("hour"),
    DAY("day"),
    MONTH("month");

    private final String wireName;

    QuotaWindow(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

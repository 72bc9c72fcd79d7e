package com.searchgate.data.entity;

/**
 * 单次代理调用的业务结果。
 */
public enum ResultStatus {

    SUCCESS("success"),
    ERROR("error"),
    QUOTA_EXHAUSTED("quota_exhausted");

    private final String wireName;

    ResultStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 解析查询参数，不认识的值返回 null（即不过滤）。
     */
    public static ResultStatus parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.equalsIgnoreCase("success")) return SUCCESS;
        if (v.equalsIgnoreCase("error")) return ERROR;
        if (v.equalsIgnoreCase("quota_exhausted") || v.equalsIgnoreCase("quota")) return QUOTA_EXHAUSTED;
        return null;
    }
}

package com.searchgate.data.entity;

/**
 * 后台任务状态机：QUEUED → RUNNING → {SUCCEEDED, FAILED}，重试时 RUNNING → QUEUED。
 */
public enum JobStatus {

    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}

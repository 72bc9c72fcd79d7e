package com.searchgate.dispatcher.realtime;

/**
 * 快照订阅者。推送失败直接抛出异常，广播器会移除该订阅者。
 */
public interface SnapshotListener {

    void onSnapshot(Object snapshot) throws Exception;

    /** 状态未变化时的心跳 */
    void onPing() throws Exception;
}

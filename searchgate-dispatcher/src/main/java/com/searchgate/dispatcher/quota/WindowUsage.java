package com.searchgate.dispatcher.quota;

import lombok.Value;

@Value
public class WindowUsage {

    long limit;
    long used;

    /** 窗口内计数下一次减少的时间（epoch 秒），窗口为空时为 null */
    Long resetAt;

    public boolean isExhausted() {
        return used >= limit;
    }
}

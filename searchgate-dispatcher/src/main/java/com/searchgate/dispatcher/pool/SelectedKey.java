package com.searchgate.dispatcher.pool;

import lombok.Value;

/**
 * 一次选 Key 的结果。fallback 表示没有 active Key，退而使用了禁用最久的 Key。
 */
@Value
public class SelectedKey {

    String keyId;
    String secret;
    boolean fallback;
}

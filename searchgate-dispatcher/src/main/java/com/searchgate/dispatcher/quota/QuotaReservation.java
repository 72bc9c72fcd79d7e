package com.searchgate.dispatcher.quota;

import lombok.Value;

/**
 * 一次已占用的配额，调用未成功时凭它退还。
 */
@Value
public class QuotaReservation {

    String tokenId;
    long hitId;
    long createdAt;
}

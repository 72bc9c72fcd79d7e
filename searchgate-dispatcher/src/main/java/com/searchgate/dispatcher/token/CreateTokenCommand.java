package com.searchgate.dispatcher.token;

import lombok.Builder;
import lombok.Value;

/**
 * 创建令牌的参数，限额为空时使用全局默认值。
 */
@Value
@Builder
public class CreateTokenCommand {

    String note;
    String group;
    Long hourlyLimit;
    Long dailyLimit;
    Long monthlyLimit;
}

package com.searchgate.dispatcher.realtime;

import com.searchgate.dispatcher.audit.LogView;
import com.searchgate.dispatcher.metrics.RequestStats;
import com.searchgate.dispatcher.token.TokenView;
import lombok.Value;

import java.util.List;

/**
 * 单个令牌的实时快照：令牌状态、本月统计与最近日志。
 */
@Value
public class TokenSnapshot {

    TokenView token;
    RequestStats summary;
    List<LogView> logs;
}

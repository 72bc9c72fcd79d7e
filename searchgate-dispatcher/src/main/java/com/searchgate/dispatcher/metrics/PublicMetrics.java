package com.searchgate.dispatcher.metrics;

import lombok.Value;

@Value
public class PublicMetrics {

    long monthlySuccess;
    long dailySuccess;
}

package com.searchgate.dispatcher.realtime;

import com.searchgate.dispatcher.audit.LogView;
import com.searchgate.dispatcher.metrics.DashboardSummary;
import com.searchgate.dispatcher.pool.KeyView;
import lombok.Value;

import java.util.List;

@Value
public class DashboardSnapshot {

    DashboardSummary summary;
    List<KeyView> keys;
    List<LogView> logs;
}

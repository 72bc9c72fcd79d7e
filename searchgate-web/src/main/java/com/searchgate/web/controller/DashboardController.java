package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.dispatcher.metrics.DashboardSummary;
import com.searchgate.dispatcher.metrics.UsageMetricsService;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.web.config.WebProperties;
import com.searchgate.web.sse.SseSnapshotListener;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * 控制台汇总与实时推送。推送不可用时前端轮询 /api/summary 等接口。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {

    private final UsageMetricsService metricsService;
    private final SnapshotBroadcaster broadcaster;
    private final WebProperties properties;

    @GetMapping("/summary")
    public ApiResponse<DashboardSummary> summary() {
        return ApiResponse.ok(metricsService.summary());
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return SseSnapshotListener.open(broadcaster, properties.getSseTimeoutMs(), broadcaster::subscribeDashboard);
    }
}

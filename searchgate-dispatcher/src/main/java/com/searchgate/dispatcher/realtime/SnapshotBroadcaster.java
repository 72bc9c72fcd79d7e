package com.searchgate.dispatcher.realtime;

import com.searchgate.common.exception.NotFoundException;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.metrics.UsageMetricsService;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.pool.KeyView;
import com.searchgate.dispatcher.token.AuthTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 实时快照广播。
 * <p>
 * 状态变化时由业务方调用 {@link #markDirty()}，定时任务按固定间隔构建快照：
 * 快照与上次推送不同才推送，否则只发心跳。推送失败的订阅者被移除。
 * 这里只是通知优化，所有数据都能通过查询接口拉取到。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotBroadcaster {

    private static final int TOKEN_RECENT_LOGS = 20;

    private final ApiKeyPool keyPool;
    private final AuditLogService auditLogService;
    private final UsageMetricsService metricsService;
    private final AuthTokenService tokenService;
    private final DispatcherProperties properties;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean dirty = new AtomicBoolean(true);

    /**
     * 订阅控制台快照，订阅后立即收到一份当前快照。
     */
    public void subscribeDashboard(SnapshotListener listener) {
        subscribe(new Subscription(listener, null));
    }

    /**
     * 订阅单个令牌的快照。
     */
    public void subscribeToken(String tokenId, SnapshotListener listener) {
        subscribe(new Subscription(listener, tokenId));
    }

    public void unsubscribe(SnapshotListener listener) {
        subscriptions.removeIf(s -> s.listener == listener);
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public void markDirty() {
        dirty.set(true);
    }

    @Scheduled(fixedDelayString = "${searchgate.dispatcher.snapshot-interval-ms:2000}")
    public void flush() {
        if (subscriptions.isEmpty()) {
            return;
        }
        boolean wasDirty = dirty.getAndSet(false);
        Map<String, Object> built = new HashMap<>();
        for (Subscription subscription : subscriptions) {
            Object snapshot;
            try {
                snapshot = built.computeIfAbsent(topicKey(subscription), k -> build(subscription));
            } catch (NotFoundException e) {
                drop(subscription, e);
                continue;
            } catch (RuntimeException e) {
                log.warn("构建快照失败，本轮跳过: {}", e.getMessage());
                dirty.set(true);
                continue;
            }
            String signature = String.valueOf(snapshot);
            if (wasDirty || !Objects.equals(signature, subscription.lastSignature)) {
                subscription.lastSignature = signature;
                deliver(subscription, snapshot);
            } else {
                ping(subscription);
            }
        }
    }

    // ==================== 内部方法 ====================

    private void subscribe(Subscription subscription) {
        Object snapshot = build(subscription);
        subscription.lastSignature = String.valueOf(snapshot);
        subscriptions.add(subscription);
        log.debug("新增快照订阅者{}, 当前 {} 个", subscription.tokenId == null ? "" : " (令牌 " + subscription.tokenId + ")",
                subscriptions.size());
        deliver(subscription, snapshot);
    }

    private Object build(Subscription subscription) {
        if (subscription.tokenId == null) {
            List<KeyView> keys = keyPool.listKeys(false).stream().map(KeyView::of).collect(Collectors.toList());
            return new DashboardSnapshot(metricsService.summary(), keys,
                    auditLogService.recent(RequestLogFilter.none(), properties.getSnapshotRecentLogs()));
        }
        String tokenId = subscription.tokenId;
        return new TokenSnapshot(
                tokenService.view(tokenService.findToken(tokenId)),
                metricsService.tokenMetrics(tokenId, null, null, "month"),
                auditLogService.recent(RequestLogFilter.builder().authTokenId(tokenId).build(), TOKEN_RECENT_LOGS));
    }

    private void deliver(Subscription subscription, Object snapshot) {
        try {
            subscription.listener.onSnapshot(snapshot);
        } catch (Exception e) {
            drop(subscription, e);
        }
    }

    private void ping(Subscription subscription) {
        try {
            subscription.listener.onPing();
        } catch (Exception e) {
            drop(subscription, e);
        }
    }

    private void drop(Subscription subscription, Exception cause) {
        subscriptions.remove(subscription);
        log.debug("推送失败，移除订阅者: {}", cause.getMessage());
    }

    private static String topicKey(Subscription subscription) {
        return subscription.tokenId == null ? "dashboard" : "token:" + subscription.tokenId;
    }

    private static final class Subscription {
        private final SnapshotListener listener;
        private final String tokenId;
        private volatile String lastSignature;

        private Subscription(SnapshotListener listener, String tokenId) {
            this.listener = listener;
            this.tokenId = tokenId;
        }
    }
}

package com.searchgate.web.sse;

import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.dispatcher.realtime.SnapshotListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * 把广播器的快照写到一个 SSE 连接上。连接结束、超时或出错时自动退订。
 */
@Slf4j
public class SseSnapshotListener implements SnapshotListener {

    private final SseEmitter emitter;

    private SseSnapshotListener(SseEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * 创建连接并注册退订回调，订阅动作由 subscriber 完成。
     */
    public static SseEmitter open(SnapshotBroadcaster broadcaster, long timeoutMs,
                                  Consumer<SnapshotListener> subscriber) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        SseSnapshotListener listener = new SseSnapshotListener(emitter);
        emitter.onCompletion(() -> broadcaster.unsubscribe(listener));
        emitter.onTimeout(() -> {
            broadcaster.unsubscribe(listener);
            emitter.complete();
        });
        emitter.onError(e -> broadcaster.unsubscribe(listener));
        subscriber.accept(listener);
        return emitter;
    }

    @Override
    public void onSnapshot(Object snapshot) throws IOException {
        emitter.send(SseEmitter.event().name("snapshot").data(snapshot, MediaType.APPLICATION_JSON));
    }

    @Override
    public void onPing() throws IOException {
        emitter.send(SseEmitter.event().name("ping").data("{}"));
    }
}

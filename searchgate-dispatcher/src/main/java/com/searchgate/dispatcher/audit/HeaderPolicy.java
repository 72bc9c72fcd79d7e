package com.searchgate.dispatcher.audit;

import com.searchgate.dispatcher.config.DispatcherProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 请求头转发策略：白名单内且不在黑名单中的头部才会转发，其余为匿名性丢弃。
 * 在写入审计日志之前应用，日志记录的就是实际发出的头部。
 */
@Component
public class HeaderPolicy {

    private final Set<String> allowed = new TreeSet<>();
    private final Set<String> blocked = new TreeSet<>();

    public HeaderPolicy(DispatcherProperties properties) {
        properties.getForwardHeaders().forEach(h -> allowed.add(h.toLowerCase(Locale.ROOT)));
        properties.getBlockedHeaders().forEach(h -> blocked.add(h.toLowerCase(Locale.ROOT)));
    }

    public FilteredHeaders apply(Map<String, String> incoming) {
        Map<String, String> forwarded = new LinkedHashMap<>();
        Set<String> forwardedNames = new TreeSet<>();
        Set<String> droppedNames = new TreeSet<>();
        for (Map.Entry<String, String> header : incoming.entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (allowed.contains(name) && !blocked.contains(name)) {
                forwarded.put(name, header.getValue());
                forwardedNames.add(name);
            } else {
                droppedNames.add(name);
            }
        }
        return new FilteredHeaders(forwarded, new ArrayList<>(forwardedNames), new ArrayList<>(droppedNames));
    }
}

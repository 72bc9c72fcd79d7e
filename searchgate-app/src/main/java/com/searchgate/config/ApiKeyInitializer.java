package com.searchgate.config;

import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.pool.KeyPoolStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 启动时把配置里的上游 Key 导入 Key 池。
 * <p>
 * 配置方式：searchgate.api-keys=tvly-key1,tvly-key2，或环境变量 SEARCHGATE_API_KEYS。
 * 只在 Key 池从未录入过任何 Key 时导入，避免重启时恢复管理员删除的 Key。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInitializer implements CommandLineRunner {

    private final ApiKeyPool keyPool;

    @Value("${searchgate.api-keys:}")
    private String apiKeysConfig;

    @Override
    public void run(String... args) {
        KeyPoolStats stats = keyPool.stats();
        long known = stats.getActiveKeys() + stats.getExhaustedKeys()
                + stats.getDisabledKeys() + stats.getDeletedKeys();
        List<String> keys = parse(apiKeysConfig);
        if (keys.isEmpty()) {
            if (known == 0) {
                log.warn("未配置上游 Key，可通过管理接口 POST /api/keys 添加，或设置 SEARCHGATE_API_KEYS");
            }
            return;
        }
        if (known > 0) {
            log.info("Key 池中已有 {} 个 Key，跳过配置导入", known);
            return;
        }
        int added = keyPool.addKeys(keys);
        log.info("已从配置导入 {} 个 Key", added);
    }

    static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}

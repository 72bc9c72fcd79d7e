package com.searchgate.dispatcher.job;

import com.searchgate.data.entity.JobEntity;
import com.searchgate.data.entity.MetaEntity;
import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.repository.MetaRepository;
import com.searchgate.data.repository.RequestLogRepository;
import com.searchgate.data.repository.TokenUsageStatRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把审计日志按 (令牌, 小时) 汇总到 t_token_usage_stat。
 * <p>
 * 水位线（最后汇总的日志 id）保存在 t_meta，与计数更新在同一事务内推进，重复执行不会重复计数。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageRollupJobHandler implements JobHandler {

    static final String WATERMARK_KEY = "usage_rollup.last_log_id";
    private static final long HOUR = 3600;

    private final RequestLogRepository logRepository;
    private final TokenUsageStatRepository statRepository;
    private final MetaRepository metaRepository;
    private final TransactionTemplate transactionTemplate;
    private final DispatcherProperties properties;

    @Override
    public boolean supports(String jobType) {
        return JobTypes.USAGE_ROLLUP.equals(jobType);
    }

    @Override
    public String execute(JobEntity job) {
        int batchSize = Math.max(1, properties.getRollupBatchSize());
        long total = 0;
        while (true) {
            Integer processed = transactionTemplate.execute(status -> rollupBatch(batchSize));
            int n = processed == null ? 0 : processed;
            total += n;
            if (n < batchSize) {
                break;
            }
        }
        return "汇总日志 " + total + " 条";
    }

    private int rollupBatch(int batchSize) {
        MetaEntity watermark = metaRepository.findByMetaKey(WATERMARK_KEY)
                .orElseGet(() -> MetaEntity.builder().metaKey(WATERMARK_KEY).metaValue("0").build());
        long lastId = Long.parseLong(watermark.getMetaValue());

        List<RequestLogEntity> logs = logRepository.findAfterId(lastId, batchSize);
        if (logs.isEmpty()) {
            return 0;
        }

        Map<String, long[]> buckets = new LinkedHashMap<>();
        for (RequestLogEntity entry : logs) {
            lastId = Math.max(lastId, entry.getId());
            if (entry.getAuthTokenId() == null || entry.getResultStatus() == null) {
                continue;
            }
            long bucketStart = Math.floorDiv(entry.getCreatedAt(), HOUR) * HOUR;
            long[] counts = buckets.computeIfAbsent(entry.getAuthTokenId() + "|" + bucketStart, k -> new long[3]);
            switch (entry.getResultStatus()) {
                case SUCCESS:
                    counts[0]++;
                    break;
                case ERROR:
                    counts[1]++;
                    break;
                default:
                    counts[2]++;
                    break;
            }
        }

        for (Map.Entry<String, long[]> bucket : buckets.entrySet()) {
            int sep = bucket.getKey().lastIndexOf('|');
            String tokenId = bucket.getKey().substring(0, sep);
            long bucketStart = Long.parseLong(bucket.getKey().substring(sep + 1));
            long[] c = bucket.getValue();
            statRepository.addToBucket(tokenId, bucketStart, c[0], c[1], c[2]);
        }

        watermark.setMetaValue(String.valueOf(lastId));
        metaRepository.save(watermark);
        log.debug("用量汇总: {} 条日志, {} 个桶, 水位线 -> {}", logs.size(), buckets.size(), lastId);
        return logs.size();
    }
}

package com.searchgate.dispatcher.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchgate.common.dto.PageResult;
import com.searchgate.common.util.SensitiveDataRedactor;
import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.data.repository.RequestLogRepository;
import com.searchgate.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 审计日志：只追加写入，按条件分页查询。
 * <p>
 * 分页以查询开始时的最大 id 为锚点，之后写入的记录不会挤乱已经翻过的页。
 * 写入失败不会吞掉请求结果：记录 ERROR 日志并进入降级状态，直到下一次写入成功。
 */
@Slf4j
@Service
public class AuditLogService {

    public static final int DEFAULT_PER_PAGE = 20;
    public static final int MAX_PER_PAGE = 200;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final RequestLogRepository repository;
    private final DispatcherProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final AtomicLong failedAppends = new AtomicLong();

    public AuditLogService(RequestLogRepository repository, DispatcherProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /**
     * 追加一条审计记录，返回记录 id；存储失败时返回 null 并进入降级状态。
     */
    public Long append(RequestLogEntity entry) {
        entry.setQuery(SensitiveDataRedactor.redact(entry.getQuery()));
        entry.setRequestBody(truncate(entry.getRequestBody()));
        entry.setResponseBody(truncate(entry.getResponseBody()));
        try {
            RequestLogEntity saved = repository.save(entry);
            if (degraded.compareAndSet(true, false)) {
                log.info("审计日志写入恢复正常");
            }
            return saved.getId();
        } catch (DataAccessException e) {
            degraded.set(true);
            long failures = failedAppends.incrementAndGet();
            log.error("审计日志写入失败 (累计 {} 次), key={}, token={}, result={}, status={}",
                    failures, entry.getKeyId(), entry.getAuthTokenId(), entry.getResultStatus(),
                    entry.getHttpStatus(), e);
            return null;
        }
    }

    public PageResult<LogView> query(LogQuery query) {
        int perPage = clampPerPage(query.getPerPage());
        int page = Math.max(1, query.getPage());
        long maxId = repository.findMaxId();
        long anchor = query.getAnchorId() == null ? maxId : Math.min(query.getAnchorId(), maxId);
        int maxItems = properties.getLogQueryMaxItems();

        long offset = query.getBefore() == null ? (long) (page - 1) * perPage : 0;
        long total = Math.min(repository.countMatching(query.getFilter(), anchor), maxItems);

        List<LogView> items;
        if (offset >= maxItems) {
            items = Collections.emptyList();
        } else {
            int limit = (int) Math.min(perPage, maxItems - offset);
            items = repository.findPage(query.getFilter(), anchor, query.getBefore(), limit, offset)
                    .stream().map(this::toView).collect(Collectors.toList());
        }
        return new PageResult<>(items, total, page, perPage, anchor);
    }

    /** 最近的 limit 条记录，id 倒序 */
    public List<LogView> recent(RequestLogFilter filter, int limit) {
        return recent(filter, limit, null);
    }

    public List<LogView> recent(RequestLogFilter filter, int limit, Long before) {
        long anchor = repository.findMaxId();
        return repository.findPage(filter, anchor, before, Math.max(1, limit), 0)
                .stream().map(this::toView).collect(Collectors.toList());
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public long getFailedAppends() {
        return failedAppends.get();
    }

    public String toHeaderJson(List<String> names) {
        try {
            return objectMapper.writeValueAsString(names);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("头部名序列化失败", e);
        }
    }

    public static int clampPerPage(int perPage) {
        if (perPage <= 0) {
            return DEFAULT_PER_PAGE;
        }
        return Math.min(MAX_PER_PAGE, perPage);
    }

    LogView toView(RequestLogEntity e) {
        return LogView.builder()
                .id(e.getId())
                .keyId(e.getKeyId())
                .authTokenId(e.getAuthTokenId())
                .method(e.getMethod())
                .path(e.getPath())
                .query(e.getQuery())
                .httpStatus(e.getHttpStatus())
                .upstreamStatus(e.getUpstreamStatus())
                .resultStatus(e.getResultStatus() == null ? null : e.getResultStatus().wireName())
                .errorMessage(e.getErrorMessage())
                .requestBody(e.getRequestBody())
                .responseBody(e.getResponseBody())
                .forwardedHeaders(parseHeaders(e.getForwardedHeaders()))
                .droppedHeaders(parseHeaders(e.getDroppedHeaders()))
                .createdAt(e.getCreatedAt() == null ? 0 : e.getCreatedAt())
                .build();
    }

    private List<String> parseHeaders(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("无法解析审计记录中的头部列表: {}", json);
            return Collections.emptyList();
        }
    }

    private String truncate(String body) {
        int max = properties.getMaxStoredBodyChars();
        if (body == null || body.length() <= max) {
            return body;
        }
        return body.substring(0, max) + "...(truncated)";
    }
}

package com.searchgate.dispatcher.proxy;

import com.searchgate.common.exception.NoEligibleKeyException;
import com.searchgate.common.exception.UpstreamException;
import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.audit.Classification;
import com.searchgate.dispatcher.audit.FilteredHeaders;
import com.searchgate.dispatcher.audit.HeaderPolicy;
import com.searchgate.dispatcher.audit.ResultClassifier;
import com.searchgate.dispatcher.config.DispatcherProperties;
import com.searchgate.dispatcher.pool.ApiKeyPool;
import com.searchgate.dispatcher.pool.SelectedKey;
import com.searchgate.dispatcher.quota.QuotaVerdict;
import com.searchgate.dispatcher.quota.TokenQuotaExceededException;
import com.searchgate.dispatcher.quota.TokenQuotaTracker;
import com.searchgate.dispatcher.realtime.SnapshotBroadcaster;
import com.searchgate.dispatcher.token.AuthTokenService;
import com.searchgate.upstream.model.ForwardRequest;
import com.searchgate.upstream.model.ForwardResponse;
import com.searchgate.upstream.provider.UpstreamProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashSet;
import java.util.Set;

/**
 * 代理主流程：校验令牌 → 占用令牌配额 → 选 Key 转发 → 判定结果 → 写审计日志并更新 Key 状态。
 * <p>
 * 上游返回配额耗尽时，该 Key 转为 exhausted，并换一个 Key 重试（最多 maxKeyAttempts 个 Key），
 * 每次尝试各写一条审计记录。网络错误等临时故障不重试，也不改变 Key 的健康状态。
 * 调用最终未成功时退还令牌配额。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyService {

    private static final int QUOTA_DENIED_STATUS = 429;
    private static final int BAD_GATEWAY = 502;

    private final AuthTokenService tokenService;
    private final TokenQuotaTracker quotaTracker;
    private final ApiKeyPool keyPool;
    private final UpstreamProvider provider;
    private final HeaderPolicy headerPolicy;
    private final ResultClassifier classifier;
    private final AuditLogService auditLogService;
    private final SnapshotBroadcaster broadcaster;
    private final DispatcherProperties properties;
    private final Clock clock;

    public ForwardResponse handle(ProxyRequest request) {
        AuthTokenEntity token = tokenService.authenticate(request.getBearerToken());
        String tokenId = token.getTokenId();

        QuotaVerdict verdict = quotaTracker.checkAndRecord(token);
        if (!verdict.isAllowed()) {
            TokenQuotaExceededException denied = new TokenQuotaExceededException(tokenId, verdict);
            audit(request, tokenId, null, null, QUOTA_DENIED_STATUS, null,
                    ResultStatus.QUOTA_EXHAUSTED, denied.getMessage(), null);
            broadcaster.markDirty();
            throw denied;
        }

        FilteredHeaders headers = headerPolicy.apply(request.getHeaders());
        ForwardRequest forward = ForwardRequest.builder()
                .method(request.getMethod())
                .path(request.getPath())
                .query(request.getQuery())
                .headers(headers.getForwarded())
                .body(request.getBody())
                .build();

        ResultStatus finalResult = ResultStatus.ERROR;
        try {
            int maxAttempts = Math.max(1, properties.getMaxKeyAttempts());
            Set<String> tried = new HashSet<>();
            ForwardResponse last = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                SelectedKey key;
                try {
                    key = keyPool.selectKey(tried);
                } catch (NoEligibleKeyException e) {
                    if (last != null) {
                        break;
                    }
                    audit(request, tokenId, null, headers, QUOTA_DENIED_STATUS, null,
                            ResultStatus.QUOTA_EXHAUSTED, e.getMessage(), null);
                    throw e;
                }
                tried.add(key.getKeyId());

                ForwardResponse response;
                try {
                    response = provider.forward(forward, key.getSecret());
                } catch (UpstreamException e) {
                    audit(request, tokenId, key.getKeyId(), headers, BAD_GATEWAY, e.getHttpStatus(),
                            ResultStatus.ERROR, e.getMessage(), null);
                    recordKeyOutcome(key.getKeyId(), ResultStatus.ERROR);
                    throw e;
                }

                Classification outcome = classifier.classify(response.getStatus(), response.getBody());
                audit(request, tokenId, key.getKeyId(), headers, response.getStatus(), outcome.getUpstreamStatus(),
                        outcome.getResult(), outcome.getErrorMessage(), response.getBody());
                recordKeyOutcome(key.getKeyId(), outcome.getResult());
                last = response;
                finalResult = outcome.getResult();

                if (outcome.getResult() != ResultStatus.QUOTA_EXHAUSTED) {
                    break;
                }
                if (attempt < maxAttempts) {
                    log.warn("Key {} 配额耗尽，换 Key 重试 ({}/{})", key.getKeyId(), attempt, maxAttempts);
                }
            }
            return last;
        } finally {
            if (finalResult != ResultStatus.SUCCESS) {
                quotaTracker.refund(verdict.getReservation());
            }
            try {
                tokenService.recordUsage(tokenId);
            } catch (DataAccessException e) {
                log.error("令牌 {} 使用记录写入失败", tokenId, e);
            }
            broadcaster.markDirty();
        }
    }

    /**
     * 审计记录已写入后再更新 Key 计数；写库失败只记错误日志，不影响已拿到的上游响应。
     */
    private void recordKeyOutcome(String keyId, ResultStatus result) {
        try {
            keyPool.recordOutcome(keyId, result);
        } catch (DataAccessException e) {
            log.error("Key {} 调用结果 {} 写入失败，计数可能偏少", keyId, result, e);
        }
    }

    private void audit(ProxyRequest request, String tokenId, String keyId, FilteredHeaders headers,
                       Integer httpStatus, Integer upstreamStatus, ResultStatus result, String error,
                       byte[] responseBody) {
        RequestLogEntity entry = RequestLogEntity.builder()
                .keyId(keyId)
                .authTokenId(tokenId)
                .method(request.getMethod())
                .path(request.getPath())
                .query(request.getQuery())
                .httpStatus(httpStatus)
                .upstreamStatus(upstreamStatus)
                .resultStatus(result)
                .errorMessage(error)
                .requestBody(text(request.getBody()))
                .responseBody(text(responseBody))
                .forwardedHeaders(headers == null ? null : auditLogService.toHeaderJson(headers.getForwardedNames()))
                .droppedHeaders(headers == null ? null : auditLogService.toHeaderJson(headers.getDroppedNames()))
                .createdAt(clock.instant().getEpochSecond())
                .build();
        auditLogService.append(entry);
    }

    private static String text(byte[] body) {
        return body == null || body.length == 0 ? null : new String(body, StandardCharsets.UTF_8);
    }
}

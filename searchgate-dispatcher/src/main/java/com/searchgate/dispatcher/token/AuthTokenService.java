package com.searchgate.dispatcher.token;

import com.searchgate.common.dto.PageResult;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.common.exception.UnauthorizedException;
import com.searchgate.common.util.IdGenerator;
import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.data.entity.TokenStatus;
import com.searchgate.data.repository.AuthTokenRepository;
import com.searchgate.dispatcher.quota.QuotaVerdict;
import com.searchgate.dispatcher.quota.TokenQuotaTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 访问令牌管理：签发、校验、轮换密钥、启停、软删除。
 * <p>
 * 令牌格式为 {@code sg-<4 位标识>-<12 位密钥>}。标识与密钥解耦，轮换只换密钥，
 * 用量和配额计数都挂在标识上。
 */
@Slf4j
@Service
public class AuthTokenService {

    public static final String TOKEN_PREFIX = "sg-";
    private static final int TOKEN_ID_LENGTH = 4;
    private static final int SECRET_LENGTH = 12;
    private static final int MAX_BATCH = 1000;
    private static final int MAX_PER_PAGE = 200;

    private final AuthTokenRepository repository;
    private final TokenQuotaTracker quotaTracker;
    private final Clock clock;

    /** 令牌表的写锁 */
    private final ReentrantLock lock = new ReentrantLock();

    public AuthTokenService(AuthTokenRepository repository, TokenQuotaTracker quotaTracker, Clock clock) {
        this.repository = repository;
        this.quotaTracker = quotaTracker;
        this.clock = clock;
    }

    public IssuedToken create(CreateTokenCommand command) {
        lock.lock();
        try {
            AuthTokenEntity entity = AuthTokenEntity.builder()
                    .tokenId(newTokenId())
                    .secret(IdGenerator.randomAlphanumeric(SECRET_LENGTH))
                    .note(blankToNull(command.getNote()))
                    .groupName(blankToNull(command.getGroup()))
                    .hourlyLimit(positiveOrNull(command.getHourlyLimit()))
                    .dailyLimit(positiveOrNull(command.getDailyLimit()))
                    .monthlyLimit(positiveOrNull(command.getMonthlyLimit()))
                    .createdAt(now())
                    .build();
            repository.save(entity);
            log.info("签发令牌: {}{}", entity.getTokenId(),
                    entity.getGroupName() == null ? "" : " (分组 " + entity.getGroupName() + ")");
            return new IssuedToken(entity.getTokenId(), format(entity));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 批量签发，数量限制在 1..1000。
     */
    public List<IssuedToken> createBatch(String group, int count, String note) {
        int n = Math.max(1, Math.min(MAX_BATCH, count));
        List<IssuedToken> issued = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            issued.add(create(CreateTokenCommand.builder().group(group).note(note).build()));
        }
        log.info("批量签发令牌 {} 个, 分组: {}", n, group);
        return issued;
    }

    /**
     * 校验 Bearer 令牌，返回对应的令牌记录。
     */
    public AuthTokenEntity authenticate(String rawToken) {
        String tokenId = parseTokenId(rawToken)
                .orElseThrow(() -> new UnauthorizedException("令牌格式错误"));
        String secret = rawToken.trim().substring(TOKEN_PREFIX.length() + TOKEN_ID_LENGTH + 1);
        AuthTokenEntity entity = repository.findByTokenId(tokenId)
                .orElseThrow(() -> new UnauthorizedException("令牌无效"));
        if (entity.getStatus() != TokenStatus.ENABLED) {
            throw new UnauthorizedException("令牌已禁用或已删除");
        }
        if (!constantTimeEquals(entity.getSecret(), secret)) {
            throw new UnauthorizedException("令牌无效");
        }
        return entity;
    }

    /**
     * 从完整令牌串中解析出标识，格式不对时返回 empty。
     */
    public static Optional<String> parseTokenId(String rawToken) {
        if (rawToken == null) {
            return Optional.empty();
        }
        String token = rawToken.trim();
        int minLength = TOKEN_PREFIX.length() + TOKEN_ID_LENGTH + 2;
        if (!token.startsWith(TOKEN_PREFIX) || token.length() < minLength
                || token.charAt(TOKEN_PREFIX.length() + TOKEN_ID_LENGTH) != '-') {
            return Optional.empty();
        }
        return Optional.of(token.substring(TOKEN_PREFIX.length(), TOKEN_PREFIX.length() + TOKEN_ID_LENGTH));
    }

    /**
     * 记录一次使用（总次数、最近使用时间）。
     */
    public void recordUsage(String tokenId) {
        lock.lock();
        try {
            repository.findByTokenId(tokenId).ifPresent(entity -> {
                entity.setTotalRequests(nz(entity.getTotalRequests()) + 1);
                entity.setLastUsedAt(now());
                repository.save(entity);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * 轮换密钥：标识、用量、配额计数不变，旧密钥立即失效。
     */
    public IssuedToken rotateSecret(String tokenId) {
        lock.lock();
        try {
            AuthTokenEntity entity = requireLive(tokenId);
            entity.setSecret(IdGenerator.randomAlphanumeric(SECRET_LENGTH));
            repository.save(entity);
            log.info("令牌 {} 已轮换密钥", tokenId);
            return new IssuedToken(tokenId, format(entity));
        } finally {
            lock.unlock();
        }
    }

    public void updateNote(String tokenId, String note) {
        lock.lock();
        try {
            AuthTokenEntity entity = requireLive(tokenId);
            entity.setNote(blankToNull(note));
            repository.save(entity);
        } finally {
            lock.unlock();
        }
    }

    public void updateStatus(String tokenId, boolean enabled) {
        changeStatus(tokenId, enabled ? TokenStatus.ENABLED : TokenStatus.DISABLED);
    }

    /** 软删除 */
    public void delete(String tokenId) {
        changeStatus(tokenId, TokenStatus.DELETED);
    }

    public String revealToken(String tokenId) {
        return format(requireLive(tokenId));
    }

    public AuthTokenEntity findToken(String tokenId) {
        return requireLive(tokenId);
    }

    public TokenView view(AuthTokenEntity entity) {
        QuotaVerdict usage = quotaTracker.currentUsage(entity);
        return TokenView.builder()
                .id(entity.getTokenId())
                .enabled(entity.getStatus() == TokenStatus.ENABLED)
                .note(entity.getNote())
                .group(entity.getGroupName())
                .totalRequests(nz(entity.getTotalRequests()))
                .createdAt(entity.getCreatedAt())
                .lastUsedAt(entity.getLastUsedAt())
                .quotaState(usage.quotaState())
                .hourly(usage.getHourly())
                .daily(usage.getDaily())
                .monthly(usage.getMonthly())
                .build();
    }

    /**
     * 分页列出未删除的令牌。group 与 noGroup 同时给出时以 group 为准。
     */
    public PageResult<TokenView> list(int page, int perPage, String group, boolean noGroup) {
        int size = Math.max(1, Math.min(MAX_PER_PAGE, perPage));
        int p = Math.max(1, page);
        String groupFilter = blankToNull(group);
        List<AuthTokenEntity> matching = repository.findAllOrdered().stream()
                .filter(t -> t.getStatus() != TokenStatus.DELETED)
                .filter(t -> groupFilter != null ? groupFilter.equals(t.getGroupName())
                        : !noGroup || t.getGroupName() == null)
                .collect(Collectors.toList());
        List<TokenView> items = matching.stream()
                .skip((long) (p - 1) * size)
                .limit(size)
                .map(this::view)
                .collect(Collectors.toList());
        return PageResult.of(items, matching.size(), p, size);
    }

    public List<TokenGroupView> groups() {
        Map<String, List<AuthTokenEntity>> byGroup = new LinkedHashMap<>();
        for (AuthTokenEntity token : repository.findAllOrdered()) {
            if (token.getStatus() == TokenStatus.DELETED || token.getGroupName() == null) {
                continue;
            }
            byGroup.computeIfAbsent(token.getGroupName(), k -> new ArrayList<>()).add(token);
        }
        return byGroup.entrySet().stream()
                .map(e -> new TokenGroupView(e.getKey(), e.getValue().size(),
                        e.getValue().stream().map(AuthTokenEntity::getCreatedAt)
                                .filter(v -> v != null).max(Comparator.naturalOrder()).orElse(null)))
                .sorted(Comparator.comparing(TokenGroupView::getName))
                .collect(Collectors.toList());
    }

    // ==================== 内部方法 ====================

    private void changeStatus(String tokenId, TokenStatus target) {
        lock.lock();
        try {
            AuthTokenEntity entity = requireLive(tokenId);
            if (entity.getStatus() == target) {
                return;
            }
            if (!entity.getStatus().canTransitionTo(target)) {
                throw new InvalidRequestException("令牌状态不能从 " + entity.getStatus() + " 变为 " + target);
            }
            entity.setStatus(target);
            if (target == TokenStatus.DELETED) {
                entity.setDeletedAt(now());
            }
            repository.save(entity);
            log.info("令牌 {} 状态更新为 {}", tokenId, target);
        } finally {
            lock.unlock();
        }
    }

    private AuthTokenEntity requireLive(String tokenId) {
        return repository.findByTokenId(tokenId)
                .filter(t -> t.getStatus() != TokenStatus.DELETED)
                .orElseThrow(() -> new NotFoundException("令牌不存在: " + tokenId));
    }

    private String newTokenId() {
        String id;
        do {
            id = IdGenerator.randomAlphanumeric(TOKEN_ID_LENGTH);
        } while (repository.existsByTokenId(id));
        return id;
    }

    private static String format(AuthTokenEntity entity) {
        return TOKEN_PREFIX + entity.getTokenId() + "-" + entity.getSecret();
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Long positiveOrNull(Long value) {
        return value == null || value <= 0 ? null : value;
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

package com.searchgate.dispatcher.token;

import com.searchgate.common.exception.NotFoundException;
import com.searchgate.common.exception.UnauthorizedException;
import com.searchgate.data.entity.AuthTokenEntity;
import com.searchgate.data.entity.TokenStatus;
import com.searchgate.data.repository.AuthTokenRepository;
import com.searchgate.dispatcher.quota.TokenQuotaTracker;
import com.searchgate.dispatcher.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthTokenService")
class AuthTokenServiceTest {

    @Mock
    private AuthTokenRepository repository;

    @Mock
    private TokenQuotaTracker quotaTracker;

    private final Map<String, AuthTokenEntity> rows = new HashMap<>();
    private AuthTokenService service;

    @BeforeEach
    void setUp() {
        lenient().when(repository.save(any(AuthTokenEntity.class))).thenAnswer(inv -> {
            AuthTokenEntity entity = inv.getArgument(0);
            rows.put(entity.getTokenId(), entity);
            return entity;
        });
        lenient().when(repository.findByTokenId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        lenient().when(repository.existsByTokenId(anyString()))
                .thenAnswer(inv -> rows.containsKey(inv.<String>getArgument(0)));
        lenient().when(repository.findAllOrdered()).thenAnswer(inv -> new ArrayList<>(rows.values()));
        service = new AuthTokenService(repository, quotaTracker, MutableClock.at("2025-03-10T08:00:00Z"));
    }

    @Test
    @DisplayName("签发的令牌格式为 sg-<4>-<12> 且可以通过校验")
    void issuedTokenAuthenticates() {
        IssuedToken issued = service.create(CreateTokenCommand.builder().note(" 测试 ").build());

        assertThat(issued.getToken()).matches("sg-[A-Za-z0-9]{4}-[A-Za-z0-9]{12}");
        assertThat(service.authenticate(issued.getToken()).getTokenId()).isEqualTo(issued.getTokenId());
        assertThat(rows.get(issued.getTokenId()).getNote()).isEqualTo("测试");
    }

    @Test
    @DisplayName("轮换密钥保留标识，旧令牌立即失效")
    void rotationKeepsIdAndInvalidatesOldSecret() {
        IssuedToken issued = service.create(CreateTokenCommand.builder().build());
        service.recordUsage(issued.getTokenId());

        IssuedToken rotated = service.rotateSecret(issued.getTokenId());

        assertThat(rotated.getTokenId()).isEqualTo(issued.getTokenId());
        assertThat(rotated.getToken()).isNotEqualTo(issued.getToken());
        assertThatThrownBy(() -> service.authenticate(issued.getToken()))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(service.authenticate(rotated.getToken()).getTotalRequests()).isEqualTo(1);
    }

    @Test
    @DisplayName("禁用或删除的令牌不能通过校验")
    void disabledTokenIsRejected() {
        IssuedToken issued = service.create(CreateTokenCommand.builder().build());

        service.updateStatus(issued.getTokenId(), false);
        assertThatThrownBy(() -> service.authenticate(issued.getToken()))
                .isInstanceOf(UnauthorizedException.class);

        service.updateStatus(issued.getTokenId(), true);
        assertThat(service.authenticate(issued.getToken()).getStatus()).isEqualTo(TokenStatus.ENABLED);

        service.delete(issued.getTokenId());
        assertThatThrownBy(() -> service.authenticate(issued.getToken()))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service.findToken(issued.getTokenId()))
                .isInstanceOf(NotFoundException.class);
        assertThat(rows.get(issued.getTokenId()).getDeletedAt()).isNotNull();
    }

    @Test
    @DisplayName("格式错误的令牌直接拒绝")
    void malformedTokens() {
        assertThat(AuthTokenService.parseTokenId("sg-ab12-secret")).contains("ab12");
        assertThat(AuthTokenService.parseTokenId("sg-ab12")).isEmpty();
        assertThat(AuthTokenService.parseTokenId("tvly-ab12-secret")).isEmpty();
        assertThat(AuthTokenService.parseTokenId("sg-ab123secret")).isEmpty();
        assertThat(AuthTokenService.parseTokenId(null)).isEmpty();
        assertThatThrownBy(() -> service.authenticate("nonsense"))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("批量签发数量被限制在 1 以上，并归入同一分组")
    void batchCreateClampsCount() {
        List<IssuedToken> none = service.createBatch("team-a", 0, null);
        List<IssuedToken> three = service.createBatch("team-a", 3, "批量");

        assertThat(none).hasSize(1);
        assertThat(three).hasSize(3);
        assertThat(service.groups()).singleElement()
                .satisfies(g -> assertThat(g.getTokenCount()).isEqualTo(4));
    }
}

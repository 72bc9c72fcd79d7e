package com.searchgate.data.repository;

import com.searchgate.data.entity.AuthTokenEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface AuthTokenRepository extends CrudRepository<AuthTokenEntity, Long> {

    Optional<AuthTokenEntity> findByTokenId(String tokenId);

    boolean existsByTokenId(String tokenId);

    @Query("SELECT * FROM t_auth_token ORDER BY created_at DESC, token_id")
    List<AuthTokenEntity> findAllOrdered();
}

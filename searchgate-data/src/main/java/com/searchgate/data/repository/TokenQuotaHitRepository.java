package com.searchgate.data.repository;

import com.searchgate.data.entity.TokenQuotaHitEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface TokenQuotaHitRepository extends CrudRepository<TokenQuotaHitEntity, Long> {

    /** 启动时重建内存窗口 */
    @Query("SELECT * FROM t_token_quota_hit WHERE created_at >= :since ORDER BY created_at, id")
    List<TokenQuotaHitEntity> findSince(long since);

    @Modifying
    @Query("DELETE FROM t_token_quota_hit WHERE created_at < :before")
    int deleteOlderThan(long before);
}

package com.searchgate.data.repository;

import com.searchgate.data.entity.TokenUsageStatEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface TokenUsageStatRepository extends CrudRepository<TokenUsageStatEntity, Long> {

    /**
     * 累加到小时桶（不存在则插入）。
     */
    @Modifying
    @Query("INSERT INTO t_token_usage_stat (token_id, bucket_start, success_count, system_failure_count, external_failure_count) "
            + "VALUES (:tokenId, :bucketStart, :success, :systemFailure, :externalFailure) "
            + "ON CONFLICT(token_id, bucket_start) DO UPDATE SET "
            + "success_count = success_count + excluded.success_count, "
            + "system_failure_count = system_failure_count + excluded.system_failure_count, "
            + "external_failure_count = external_failure_count + excluded.external_failure_count")
    int addToBucket(String tokenId, long bucketStart, long success, long systemFailure, long externalFailure);

    @Query("SELECT * FROM t_token_usage_stat WHERE token_id = :tokenId "
            + "AND bucket_start >= :since AND bucket_start < :until ORDER BY bucket_start")
    List<TokenUsageStatEntity> findRange(String tokenId, long since, long until);

    @Modifying
    @Query("DELETE FROM t_token_usage_stat WHERE bucket_start < :before")
    int deleteOlderThan(long before);
}

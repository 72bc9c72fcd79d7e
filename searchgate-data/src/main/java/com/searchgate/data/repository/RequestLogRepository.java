package com.searchgate.data.repository;

import com.searchgate.data.entity.RequestLogEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface RequestLogRepository extends CrudRepository<RequestLogEntity, Long>, RequestLogRepositoryCustom {

    @Query("SELECT COALESCE(MAX(id), 0) FROM t_request_log")
    long findMaxId();

    /** 汇总任务按 id 顺序增量读取 */
    @Query("SELECT * FROM t_request_log WHERE id > :afterId ORDER BY id LIMIT :limit")
    List<RequestLogEntity> findAfterId(long afterId, int limit);

    @Modifying
    @Query("DELETE FROM t_request_log WHERE created_at < :before")
    int deleteOlderThan(long before);
}

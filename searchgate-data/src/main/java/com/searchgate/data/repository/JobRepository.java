package com.searchgate.data.repository;

import com.searchgate.data.entity.JobEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface JobRepository extends CrudRepository<JobEntity, Long> {

    /** 到期可执行的排队任务 */
    @Query("SELECT * FROM t_job WHERE status = 'QUEUED' AND next_run_at <= :now ORDER BY next_run_at, id LIMIT :limit")
    List<JobEntity> findDue(long now, int limit);

    @Query("SELECT * FROM t_job WHERE status = 'RUNNING'")
    List<JobEntity> findRunning();

    /** 同类型同目标是否已有未结束的任务 */
    @Query("SELECT COUNT(*) FROM t_job WHERE job_type = :jobType "
            + "AND (key_id = :keyId OR (key_id IS NULL AND :keyId IS NULL)) "
            + "AND status IN ('QUEUED', 'RUNNING')")
    long countPending(String jobType, String keyId);

    /** typePattern 为 LIKE 模式，null 表示全部 */
    @Query("SELECT * FROM t_job WHERE (:typePattern IS NULL OR job_type LIKE :typePattern) "
            + "ORDER BY id DESC LIMIT :limit OFFSET :offset")
    List<JobEntity> findPage(String typePattern, int limit, long offset);

    @Query("SELECT COUNT(*) FROM t_job WHERE (:typePattern IS NULL OR job_type LIKE :typePattern)")
    long countByPattern(String typePattern);

    @Modifying
    @Query("DELETE FROM t_job WHERE status IN ('SUCCEEDED', 'FAILED') AND finished_at < :before")
    int deleteFinishedBefore(long before);
}

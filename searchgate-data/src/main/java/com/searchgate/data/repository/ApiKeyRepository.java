package com.searchgate.data.repository;

import com.searchgate.data.entity.ApiKeyEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

/**
 * Key 表只在启动时整表加载，之后的查找都走 Key 池的内存缓存。
 */
public interface ApiKeyRepository extends CrudRepository<ApiKeyEntity, Long> {

    @Query("SELECT * FROM t_api_key ORDER BY key_id")
    List<ApiKeyEntity> findAllOrdered();
}

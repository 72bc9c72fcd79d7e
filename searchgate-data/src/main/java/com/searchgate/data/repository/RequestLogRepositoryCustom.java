package com.searchgate.data.repository;

import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.entity.ResultStatus;

import java.util.List;
import java.util.Map;

/**
 * 审计日志的动态查询片段，条件组合较多，不适合派生查询。
 */
public interface RequestLogRepositoryCustom {

    /**
     * 按 id 倒序分页。anchorId 之后追加的行不可见，保证翻页稳定；beforeId 为游标（不含）。
     */
    List<RequestLogEntity> findPage(RequestLogFilter filter, long anchorId, Long beforeId, int limit, long offset);

    long countMatching(RequestLogFilter filter, long anchorId);

    Map<ResultStatus, Long> countByResult(RequestLogFilter filter);

    /** 无记录时返回 null */
    Long findLastActivity(RequestLogFilter filter);

    /**
     * 以 bucketSecs 为宽度聚合，桶起点对齐到 epoch。仅返回有数据的桶。
     */
    List<UsageBucket> aggregateBuckets(RequestLogFilter filter, long bucketSecs);
}

package com.searchgate.dispatcher.audit;

import com.searchgate.data.repository.RequestLogFilter;
import lombok.Builder;
import lombok.Value;

/**
 * 审计日志分页查询。首次查询不带 anchorId，之后翻页带回返回的 anchorId。
 */
@Value
@Builder
public class LogQuery {

    RequestLogFilter filter;

    @Builder.Default
    int page = 1;

    @Builder.Default
    int perPage = 20;

    Long anchorId;

    /** 游标：只返回 id 小于它的记录 */
    Long before;
}

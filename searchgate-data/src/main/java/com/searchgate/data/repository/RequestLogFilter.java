package com.searchgate.data.repository;

import com.searchgate.data.entity.ResultStatus;
import lombok.Builder;
import lombok.Value;

/**
 * 审计日志查询条件，字段为空表示不过滤。时间区间为 [since, until)。
 */
@Value
@Builder
public class RequestLogFilter {

    String keyId;
    String authTokenId;
    ResultStatus resultStatus;
    Long since;
    Long until;

    public static RequestLogFilter none() {
        return RequestLogFilter.builder().build();
    }
}

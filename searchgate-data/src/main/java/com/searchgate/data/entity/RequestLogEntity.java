package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 代理调用审计日志：只追加，正常流程中不修改不删除。
 */
@Table("t_request_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLogEntity {

    @Id
    private Long id;

    /** 令牌被拒绝时未选中 Key，为空 */
    private String keyId;

    private String authTokenId;

    private String method;
    private String path;
    private String query;

    private Integer httpStatus;

    /** 响应体中结构化的上游状态码 */
    private Integer upstreamStatus;

    private ResultStatus resultStatus;

    private String errorMessage;

    private String requestBody;
    private String responseBody;

    /** JSON 数组，转发到上游的头部名 */
    private String forwardedHeaders;

    /** JSON 数组，为匿名性丢弃的头部名 */
    private String droppedHeaders;

    private Long createdAt;
}

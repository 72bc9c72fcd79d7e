package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.dto.PageResult;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.data.repository.RequestLogFilter;
import com.searchgate.dispatcher.audit.AuditLogService;
import com.searchgate.dispatcher.audit.LogQuery;
import com.searchgate.dispatcher.audit.LogView;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 审计日志查询（仅管理员）。翻页时带回首页返回的 anchor_id。
 */
@RestController
@RequestMapping("/api/logs")
@RequiredArgsConstructor
public class LogController {

    private final AuditLogService auditLogService;

    @GetMapping
    public ApiResponse<PageResult<LogView>> list(
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "per_page", defaultValue = "20") int perPage,
            @RequestParam(value = "result", required = false) String result,
            @RequestParam(value = "key_id", required = false) String keyId,
            @RequestParam(value = "token_id", required = false) String tokenId,
            @RequestParam(value = "since", required = false) String since,
            @RequestParam(value = "until", required = false) String until,
            @RequestParam(value = "anchor_id", required = false) Long anchorId,
            @RequestParam(value = "before", required = false) Long before) {
        RequestLogFilter filter = RequestLogFilter.builder()
                .keyId(keyId)
                .authTokenId(tokenId)
                .resultStatus(ResultStatus.parse(result))
                .since(TimeParams.parse(since, "since"))
                .until(TimeParams.parse(until, "until"))
                .build();
        return ApiResponse.ok(auditLogService.query(LogQuery.builder()
                .filter(filter)
                .page(page)
                .perPage(perPage)
                .anchorId(anchorId)
                .before(before)
                .build()));
    }
}

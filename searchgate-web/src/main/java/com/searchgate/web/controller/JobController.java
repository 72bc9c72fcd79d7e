package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.dto.PageResult;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.dispatcher.job.JobRunner;
import com.searchgate.dispatcher.job.JobView;
import com.searchgate.web.dto.EnqueueJobRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 后台任务（仅管理员）。group 取值 all / quota / usage / logs / rollover。
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobRunner jobRunner;

    @GetMapping
    public ApiResponse<PageResult<JobView>> list(
            @RequestParam(value = "group", defaultValue = "all") String group,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "per_page", defaultValue = "20") int perPage) {
        return ApiResponse.ok(jobRunner.list(group, page, perPage));
    }

    @GetMapping("/{id}")
    public ApiResponse<JobView> detail(@PathVariable("id") long id) {
        return ApiResponse.ok(jobRunner.get(id));
    }

    @PostMapping
    public ApiResponse<JobView> enqueue(@RequestBody EnqueueJobRequest request) {
        if (request.getType() == null || request.getType().isBlank()) {
            throw new InvalidRequestException("缺少任务类型");
        }
        return ApiResponse.ok(jobRunner.enqueue(request.getType().trim(), request.getKeyId()));
    }
}

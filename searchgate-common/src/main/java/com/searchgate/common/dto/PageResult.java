package com.searchgate.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageResult<T> {

    private List<T> items;

    private long total;

    private int page;

    private int perPage;

    /**
     * 查询开始时的最大记录 ID。翻页时带回，保证并发写入下不重不漏。
     */
    private Long anchorId;

    public static <T> PageResult<T> of(List<T> items, long total, int page, int perPage) {
        return new PageResult<>(items, total, page, perPage, null);
    }
}

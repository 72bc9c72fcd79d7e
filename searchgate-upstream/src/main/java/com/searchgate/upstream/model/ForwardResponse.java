package com.searchgate.upstream.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 上游响应。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForwardResponse {

    private int status;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    private byte[] body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}

package com.searchgate.dispatcher.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchgate.data.entity.ResultStatus;
import com.searchgate.upstream.provider.UpstreamProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 根据上游响应判定业务结果。
 * <p>
 * MCP 响应即使 HTTP 200 也可能在 {@code result.structuredContent.status} 里携带真实状态码，
 * 它优先于 HTTP 状态码；{@code result.structuredContent.isError} 为 true 视为错误。
 * 流式响应（text/event-stream）取最后一条 data 行解析。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultClassifier {

    private final UpstreamProvider provider;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public Classification classify(int httpStatus, byte[] body) {
        JsonNode structured = structuredContent(body);
        if (structured != null) {
            JsonNode status = structured.get("status");
            if (status != null && status.canConvertToInt()) {
                int code = status.asInt();
                if (provider.isQuotaExhausted(code)) {
                    return new Classification(ResultStatus.QUOTA_EXHAUSTED, code, "上游 Key 配额耗尽");
                }
                if (code >= 400) {
                    return new Classification(ResultStatus.ERROR, code, "上游返回错误状态 " + code);
                }
                return new Classification(httpOutcome(httpStatus), code, httpMessage(httpStatus));
            }
            JsonNode isError = structured.get("isError");
            if (isError != null && isError.asBoolean(false)) {
                return new Classification(ResultStatus.ERROR, null, "上游返回 isError");
            }
        }
        if (provider.isQuotaExhausted(httpStatus)) {
            return new Classification(ResultStatus.QUOTA_EXHAUSTED, null, "上游 Key 配额耗尽");
        }
        return new Classification(httpOutcome(httpStatus), null, httpMessage(httpStatus));
    }

    private static ResultStatus httpOutcome(int httpStatus) {
        return httpStatus >= 200 && httpStatus < 300 ? ResultStatus.SUCCESS : ResultStatus.ERROR;
    }

    private static String httpMessage(int httpStatus) {
        return httpStatus >= 200 && httpStatus < 300 ? null : "上游 HTTP " + httpStatus;
    }

    private JsonNode structuredContent(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        String text = jsonPayload(new String(body, StandardCharsets.UTF_8));
        if (text == null) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(text);
            JsonNode structured = root.path("result").path("structuredContent");
            return structured.isObject() ? structured : null;
        } catch (IOException e) {
            log.debug("上游响应不是 JSON，按 HTTP 状态判定: {}", e.getMessage());
            return null;
        }
    }

    /** 普通 JSON 原样返回；SSE 取最后一条 data 行 */
    private static String jsonPayload(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        String last = null;
        for (String line : trimmed.split("\n")) {
            String l = line.trim();
            if (l.startsWith("data:")) {
                String data = l.substring("data:".length()).trim();
                if (data.startsWith("{")) {
                    last = data;
                }
            }
        }
        return last;
    }
}

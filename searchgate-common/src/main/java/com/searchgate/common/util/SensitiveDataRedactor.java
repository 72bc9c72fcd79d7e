package com.searchgate.common.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 敏感信息脱敏：对外暴露的日志、错误信息中抹去上游 Key。
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "<redacted>";

    /** 查询参数形式：tavilyApiKey=xxx */
    private static final Pattern QUERY_KEY =
            Pattern.compile("(?i)(tavilyapikey=)[^&)\\s\"'\\n]*");

    /** 头部形式：Tavily-Api-Key: xxx */
    private static final Pattern HEADER_KEY =
            Pattern.compile("(?i)(tavily-api-key:)[^\\r\\n]*");

    private SensitiveDataRedactor() {
    }

    public static String redact(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        String out = QUERY_KEY.matcher(input).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
        return HEADER_KEY.matcher(out).replaceAll("$1 " + Matcher.quoteReplacement(REDACTED));
    }

    /**
     * 日志中只保留前缀，如 "tvly-abc***"。
     */
    public static String maskKey(String key) {
        if (key == null || key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }
}

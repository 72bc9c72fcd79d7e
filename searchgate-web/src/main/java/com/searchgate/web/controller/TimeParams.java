package com.searchgate.web.controller;

import com.searchgate.common.exception.InvalidRequestException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 时间参数既接受 epoch 秒，也接受 RFC 3339 字符串。
 */
final class TimeParams {

    private TimeParams() {
    }

    static Long parse(String raw, String name) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        try {
            return OffsetDateTime.parse(value).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(name + " 不是合法的时间: " + value);
        }
    }
}

package com.searchgate.dispatcher.quota;

import com.searchgate.common.exception.SearchGateException;

/**
 * 令牌超出配额，请求在转发上游之前被拒绝。
 */
public class TokenQuotaExceededException extends SearchGateException {

    private final String tokenId;
    private final QuotaVerdict verdict;

    public TokenQuotaExceededException(String tokenId, QuotaVerdict verdict) {
        super("QUOTA_EXCEEDED", "令牌 " + tokenId + " 超出" + describe(verdict.getExceededWindow()) + "配额");
        this.tokenId = tokenId;
        this.verdict = verdict;
    }

    public String getTokenId() {
        return tokenId;
    }

    public QuotaVerdict getVerdict() {
        return verdict;
    }

    private static String describe(QuotaWindow window) {
        if (window == null) {
            return "";
        }
        switch (window) {
            case HOUR:
                return "小时";
            case DAY:
                return "日";
            default:
                return "月度";
        }
    }
}

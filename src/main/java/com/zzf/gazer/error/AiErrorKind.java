package com.zzf.gazer.error;

/**
 * Failure classes shared by every provider.
 */
public enum AiErrorKind {
    NETWORK("network", true),
    RATE_LIMIT("rate_limit", true),
    SERVER("server", true),
    CONTENT_POLICY("content_policy", false),
    CLIENT("client", false),
    UNKNOWN("unknown", false);

    private final String code;
    private final boolean retryable;

    AiErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

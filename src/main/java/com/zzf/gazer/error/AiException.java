package com.zzf.gazer.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.util.Locale;

/**
 * Failure reported by (or while talking to) an AI provider.
 * Every I/O and decode failure of a provider surfaces as this type with the original cause attached.
 */
@Getter
public class AiException extends RuntimeException {

    private final String providerName;
    private final String modelName;
    private final int httpStatus;
    private final String errorCode;
    private final String detail;

    @Builder
    public AiException(String providerName, String modelName, int httpStatus, String errorCode, String detail, Throwable cause) {
        super(render(providerName, modelName, httpStatus, errorCode, detail, cause), cause);
        this.providerName = providerName;
        this.modelName = modelName;
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public AiException withModel(String model) {
        return new AiException(providerName, model, httpStatus, errorCode, detail, getCause());
    }

    public AiErrorKind kind() {
        if (httpStatus == 429) {
            return AiErrorKind.RATE_LIMIT;
        }
        if (httpStatus >= 500) {
            return AiErrorKind.SERVER;
        }
        if (httpStatus == 400 && detail != null && detail.toLowerCase(Locale.ROOT).contains("policy")) {
            return AiErrorKind.CONTENT_POLICY;
        }
        if (httpStatus >= 400 && httpStatus < 500) {
            return AiErrorKind.CLIENT;
        }
        if (httpStatus == 0 && getCause() instanceof IOException && !(getCause() instanceof JsonProcessingException)) {
            return AiErrorKind.NETWORK;
        }
        return AiErrorKind.UNKNOWN;
    }

    public boolean isRetryable() {
        return kind().isRetryable();
    }

    public static AiErrorKind kindOf(Throwable error) {
        AiException aiError = find(error);
        return aiError == null ? AiErrorKind.UNKNOWN : aiError.kind();
    }

    public static boolean isRetryable(Throwable error) {
        AiException aiError = find(error);
        return aiError != null && aiError.isRetryable();
    }

    private static AiException find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof AiException aiError) {
                return aiError;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String render(String provider, String model, int status, String code, String detail, Throwable cause) {
        String msg = detail;
        if ((msg == null || msg.isEmpty()) && cause != null) {
            msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (msg == null) {
            msg = "";
        }
        if (provider != null && !provider.isEmpty() && model != null && !model.isEmpty()) {
            msg = "[" + provider + ":" + model + "] " + msg;
        }
        if (code != null && !code.isEmpty()) {
            msg = msg + " (code: " + code + ")";
        }
        if (status != 0) {
            msg = status + " " + msg;
        }
        return msg;
    }
}

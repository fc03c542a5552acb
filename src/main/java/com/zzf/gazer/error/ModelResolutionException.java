package com.zzf.gazer.error;

import lombok.Getter;

/**
 * Raised when a model specifier cannot be turned into a provider and model.
 */
@Getter
public class ModelResolutionException extends RuntimeException {

    public enum Reason {
        INVALID_FORMAT,
        PROVIDER_NOT_FOUND,
        MODEL_NOT_FOUND
    }

    private final Reason reason;

    public ModelResolutionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ModelResolutionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ModelResolutionException invalidFormat(String spec) {
        return new ModelResolutionException(Reason.INVALID_FORMAT,
                "invalid model format, expected provider:model: " + spec);
    }

    public static ModelResolutionException providerNotFound(String provider) {
        return new ModelResolutionException(Reason.PROVIDER_NOT_FOUND, "provider not found: " + provider);
    }
}

package com.zzf.gazer.provider;

import com.zzf.gazer.error.ModelResolutionException;
import lombok.Value;

/**
 * A parsed {@code provider:model} specifier. Only the first colon separates; model ids may contain more.
 */
@Value
public class ModelSpec {

    public static final String SEPARATOR = ":";

    String provider;
    String model;

    /**
     * @throws ModelResolutionException with {@code INVALID_FORMAT} when there is no separator
     */
    public static ModelSpec parse(String spec) {
        if (spec == null) {
            throw ModelResolutionException.invalidFormat("null");
        }
        int at = spec.indexOf(SEPARATOR);
        if (at < 0) {
            throw ModelResolutionException.invalidFormat(spec);
        }
        return new ModelSpec(spec.substring(0, at), spec.substring(at + SEPARATOR.length()));
    }

    public static boolean isValid(String spec) {
        return spec != null && spec.contains(SEPARATOR);
    }

    @Override
    public String toString() {
        return provider + SEPARATOR + model;
    }
}

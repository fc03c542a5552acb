package com.zzf.gazer.error;

import com.zzf.gazer.model.ModelInfo;
import lombok.Getter;

/**
 * The model is unknown to the provider. Carries a placeholder with only id and provider set.
 */
@Getter
public class ModelNotFoundException extends ModelResolutionException {

    private final ModelInfo placeholder;

    public ModelNotFoundException(ModelInfo placeholder) {
        super(Reason.MODEL_NOT_FOUND, "model not found: " + placeholder.fullName());
        this.placeholder = placeholder;
    }
}

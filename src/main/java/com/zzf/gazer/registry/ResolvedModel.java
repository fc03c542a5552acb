package com.zzf.gazer.registry;

import com.zzf.gazer.provider.Provider;
import lombok.Value;

/**
 * Outcome of model resolution: the provider to call and the model name on it.
 */
@Value
public class ResolvedModel {
    Provider provider;
    String modelName;

    public String spec() {
        return provider.getName() + ":" + modelName;
    }
}

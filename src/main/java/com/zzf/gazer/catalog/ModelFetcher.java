package com.zzf.gazer.catalog;

import com.zzf.gazer.model.ModelInfo;

import java.util.List;

/**
 * Live listing of a provider's models. Failures surface as {@link com.zzf.gazer.error.AiException}.
 */
@FunctionalInterface
public interface ModelFetcher {

    List<ModelInfo> fetch();
}

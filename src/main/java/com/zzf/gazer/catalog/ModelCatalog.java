package com.zzf.gazer.catalog;

import com.zzf.gazer.error.ModelNotFoundException;
import com.zzf.gazer.model.ModelInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Model catalog of one provider.
 * <p>
 * Lookups go configured entries, then the in-memory cache while it is younger than the TTL, then a live fetch.
 * Configured entries win over fetched ones with the same id on every path.
 * The cache is swapped wholesale under the write lock; readers never see a partially filled map.
 */
@Slf4j
public class ModelCatalog {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final String providerName;
    private final Map<String, ModelInfo> configured;
    private final ModelFetcher fetcher;
    private final boolean configOnly;
    private final boolean onlyFreeModels;
    private final Clock clock;
    private final Duration ttl;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, ModelInfo> cache = Collections.emptyMap();
    private Instant syncedAt = Instant.EPOCH;

    private ModelCatalog(Builder builder) {
        this.providerName = builder.providerName;
        this.configured = Collections.unmodifiableMap(index(builder.configured));
        this.fetcher = builder.fetcher;
        this.configOnly = builder.configOnly || builder.fetcher == null;
        this.onlyFreeModels = builder.onlyFreeModels;
        this.clock = builder.clock;
        this.ttl = builder.ttl;
    }

    public static Builder builder(String providerName) {
        return new Builder(providerName);
    }

    public String getProviderName() {
        return providerName;
    }

    public boolean isOnlyFreeModels() {
        return onlyFreeModels;
    }

    public Map<String, ModelInfo> configuredModels() {
        return configured;
    }

    /**
     * The catalog keyed by model id.
     *
     * @param onlyFree   narrow the result to free models for this call
     * @param forceFresh skip the cache and fetch
     */
    public Map<String, ModelInfo> getModels(boolean onlyFree, boolean forceFresh) {
        boolean freeView = onlyFree || onlyFreeModels;
        if (configOnly) {
            return freeView ? filterFree(configured) : configured;
        }
        if (!forceFresh) {
            Map<String, ModelInfo> cached = freshCache();
            if (!cached.isEmpty()) {
                return freeView ? filterFree(cached) : cached;
            }
        }

        Map<String, ModelInfo> fetched = index(fetcher.fetch());
        Map<String, ModelInfo> merged = withConfigured(fetched);
        // configured entries go through the free filter like fetched ones
        Map<String, ModelInfo> result = freeView ? filterFree(merged) : merged;
        // an ad-hoc free view must not shrink the shared cache
        if (!onlyFree || onlyFreeModels) {
            replace(result);
        }
        log.debug("fetched model catalog provider={} models={} onlyFree={}", providerName, result.size(), freeView);
        return result;
    }

    /**
     * Resolves a model by id.
     *
     * @throws ModelNotFoundException carrying a placeholder when no tier knows the id
     */
    public ModelInfo getModelInfo(String name) {
        ModelInfo model = configured.get(name);
        if (model != null) {
            return model;
        }
        model = freshCache().get(name);
        if (model != null) {
            return model;
        }
        if (!configOnly) {
            model = getModels(false, true).get(name);
            if (model != null) {
                return model;
            }
        }
        throw new ModelNotFoundException(ModelInfo.placeholder(name, providerName));
    }

    /**
     * Cache contents while younger than the TTL, otherwise empty.
     */
    public Map<String, ModelInfo> freshCache() {
        lock.readLock().lock();
        try {
            if (cache.isEmpty() || !clock.instant().isBefore(syncedAt.plus(ttl))) {
                return Collections.emptyMap();
            }
            return cache;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void replace(Map<String, ModelInfo> models) {
        Map<String, ModelInfo> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        lock.writeLock().lock();
        try {
            cache = snapshot;
            syncedAt = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Instant getSyncedAt() {
        lock.readLock().lock();
        try {
            return syncedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    Map<String, ModelInfo> withConfigured(Map<String, ModelInfo> models) {
        Map<String, ModelInfo> merged = new LinkedHashMap<>(models);
        merged.putAll(configured);
        return Collections.unmodifiableMap(merged);
    }

    public static Map<String, ModelInfo> filterFree(Map<String, ModelInfo> models) {
        Map<String, ModelInfo> free = new LinkedHashMap<>();
        models.forEach((id, model) -> {
            if (model.isFree()) {
                free.put(id, model);
            }
        });
        return Collections.unmodifiableMap(free);
    }

    private Map<String, ModelInfo> index(Collection<ModelInfo> models) {
        Map<String, ModelInfo> indexed = new LinkedHashMap<>();
        if (models == null) {
            return indexed;
        }
        for (ModelInfo model : models) {
            if (model == null || model.getId() == null) {
                continue;
            }
            ModelInfo owned = providerName.equals(model.getProvider()) ? model : model.withProvider(providerName);
            indexed.put(owned.getId(), owned);
        }
        return indexed;
    }

    public static class Builder {
        private final String providerName;
        private Collection<ModelInfo> configured = Collections.emptyList();
        private ModelFetcher fetcher;
        private boolean configOnly;
        private boolean onlyFreeModels;
        private Clock clock = Clock.systemUTC();
        private Duration ttl = DEFAULT_TTL;

        private Builder(String providerName) {
            this.providerName = providerName;
        }

        public Builder configured(Collection<ModelInfo> configured) {
            this.configured = configured;
            return this;
        }

        public Builder fetcher(ModelFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        /**
         * Answer from configuration only, never fetch.
         */
        public Builder configOnly(boolean configOnly) {
            this.configOnly = configOnly;
            return this;
        }

        public Builder onlyFreeModels(boolean onlyFreeModels) {
            this.onlyFreeModels = onlyFreeModels;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public ModelCatalog build() {
            return new ModelCatalog(this);
        }
    }
}

package com.zzf.gazer.catalog;

import com.zzf.gazer.error.AiException;
import com.zzf.gazer.error.ModelNotFoundException;
import com.zzf.gazer.model.ModelInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelCatalogTest {

    private MutableClock clock;
    private AtomicInteger fetches;
    private List<ModelInfo> live;

    private static ModelInfo model(String id, boolean free) {
        return ModelInfo.builder()
                .id(id)
                .pricing(free ? ModelInfo.Pricing.FREE : ModelInfo.Pricing.builder()
                        .prompt("0.001").completion("0.002").image("0").webSearch("0").build())
                .build();
    }

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        fetches = new AtomicInteger();
        live = new ArrayList<>(List.of(model("paid", false), model("free-a", true), model("free-b", true)));
    }

    private ModelCatalog.Builder catalog() {
        return ModelCatalog.builder("openrouter")
                .clock(clock)
                .fetcher(() -> {
                    fetches.incrementAndGet();
                    return new ArrayList<>(live);
                });
    }

    @Test
    public void testCacheServesUntilTtlElapses() {
        ModelCatalog catalog = catalog().build();

        catalog.getModels(false, false);
        clock.advance(Duration.ofMinutes(29));
        catalog.getModels(false, false);
        assertEquals(1, fetches.get());

        clock.advance(Duration.ofMinutes(1));
        catalog.getModels(false, false);
        assertEquals(2, fetches.get());
    }

    @Test
    public void testForceFreshAlwaysFetches() {
        ModelCatalog catalog = catalog().build();

        catalog.getModels(false, false);
        catalog.getModels(false, true);

        assertEquals(2, fetches.get());
    }

    @Test
    public void testRefreshReplacesWholesale() {
        ModelCatalog catalog = catalog().build();
        catalog.getModels(false, false);

        live.clear();
        live.add(model("new", true));
        Map<String, ModelInfo> refreshed = catalog.getModels(false, true);

        assertEquals(1, refreshed.size());
        assertFalse(catalog.freshCache().containsKey("paid"));
        assertEquals(clock.instant(), catalog.getSyncedAt());
    }

    @Test
    public void testFetchedModelsBelongToProvider() {
        Map<String, ModelInfo> models = catalog().build().getModels(false, false);

        assertEquals("openrouter", models.get("paid").getProvider());
    }

    @Test
    public void testConfiguredEntryWinsOnEveryPath() {
        ModelInfo configured = ModelInfo.builder().id("paid").provider("openrouter").pricing(ModelInfo.Pricing.FREE).build();
        ModelCatalog catalog = catalog().configured(List.of(configured)).build();

        Map<String, ModelInfo> fetched = catalog.getModels(false, true);

        assertTrue(fetched.get("paid").isFree());
        assertTrue(catalog.getModelInfo("paid").isFree());
        assertTrue(catalog.freshCache().get("paid").isFree());
    }

    @Test
    public void testConfiguredModelsJoinTheFullCatalog() {
        ModelInfo configured = ModelInfo.builder().id("private").provider("openrouter").build();
        ModelCatalog catalog = catalog().configured(List.of(configured)).build();

        assertTrue(catalog.getModels(false, true).containsKey("private"));
        assertFalse(catalog.getModels(true, true).containsKey("private"));
        assertFalse(catalog.getModels(true, false).containsKey("private"));
    }

    @Test
    public void testFreeViewKeepsOnlyFreeConfiguredModels() {
        ModelInfo paidConfigured = ModelInfo.builder().id("paid-configured").provider("openrouter").build();
        ModelInfo freeConfigured = ModelInfo.builder().id("free-configured").provider("openrouter")
                .pricing(ModelInfo.Pricing.FREE).build();
        ModelCatalog catalog = catalog().configured(List.of(paidConfigured, freeConfigured)).build();

        Map<String, ModelInfo> free = catalog.getModels(true, true);

        assertEquals(List.of("free-a", "free-b", "free-configured"), List.copyOf(free.keySet()));
        assertTrue(free.values().stream().allMatch(ModelInfo::isFree));
    }

    @Test
    public void testFreeOnlyProviderNeverCachesPaidConfiguredModels() {
        ModelInfo paidConfigured = ModelInfo.builder().id("paid-configured").provider("openrouter").build();
        ModelCatalog catalog = catalog().onlyFreeModels(true).configured(List.of(paidConfigured)).build();

        Map<String, ModelInfo> fetched = catalog.getModels(false, true);
        Map<String, ModelInfo> cached = catalog.getModels(false, false);

        assertFalse(fetched.containsKey("paid-configured"));
        assertFalse(cached.containsKey("paid-configured"));
        assertFalse(catalog.freshCache().containsKey("paid-configured"));
        assertEquals(1, fetches.get());
        // direct lookups still see the configured entry
        assertEquals("paid-configured", catalog.getModelInfo("paid-configured").getId());
    }

    @Test
    public void testAdHocFreeViewIsNotPersisted() {
        ModelCatalog catalog = catalog().build();

        Map<String, ModelInfo> free = catalog.getModels(true, true);

        assertEquals(2, free.size());
        assertTrue(catalog.freshCache().isEmpty());
    }

    @Test
    public void testFreeOnlyProviderPersistsFreeView() {
        ModelCatalog catalog = catalog().onlyFreeModels(true).build();

        Map<String, ModelInfo> models = catalog.getModels(false, true);

        assertEquals(2, models.size());
        assertEquals(2, catalog.freshCache().size());
        assertFalse(models.containsKey("paid"));
    }

    @Test
    public void testFreeViewOfCachedCatalog() {
        ModelCatalog catalog = catalog().build();
        catalog.getModels(false, false);

        Map<String, ModelInfo> free = catalog.getModels(true, false);

        assertEquals(1, fetches.get());
        assertEquals(2, free.size());
    }

    @Test
    public void testLookupFetchesWhenCacheIsStale() {
        ModelCatalog catalog = catalog().build();

        assertEquals("free-a", catalog.getModelInfo("free-a").getId());
        assertEquals(1, fetches.get());
        catalog.getModelInfo("free-b");
        assertEquals(1, fetches.get());
    }

    @Test
    public void testUnknownModelCarriesPlaceholder() {
        ModelCatalog catalog = catalog().build();

        ModelNotFoundException error = assertThrows(ModelNotFoundException.class, () -> catalog.getModelInfo("ghost"));

        assertEquals("ghost", error.getPlaceholder().getId());
        assertEquals("openrouter", error.getPlaceholder().getProvider());
        assertNull(error.getPlaceholder().getArchitecture());
    }

    @Test
    public void testFetchFailurePropagates() {
        ModelCatalog catalog = ModelCatalog.builder("p")
                .clock(clock)
                .fetcher(() -> {
                    throw AiException.builder().providerName("p").httpStatus(503).detail("down").build();
                })
                .build();

        assertThrows(AiException.class, () -> catalog.getModels(false, false));
    }

    @Test
    public void testConfigOnlyNeverFetches() {
        ModelInfo mini = ModelInfo.builder().id("mini").provider("local").build();
        ModelCatalog catalog = catalog().configured(List.of(mini)).configOnly(true).build();

        assertEquals(1, catalog.getModels(false, true).size());
        assertSame(catalog.configuredModels().get("mini"), catalog.getModelInfo("mini"));
        assertThrows(ModelNotFoundException.class, () -> catalog.getModelInfo("paid"));
        assertEquals(0, fetches.get());
    }
}

package com.example.hostguard.cache;

import com.example.hostguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheManagerTest {

    @Mock
    private DurableCacheBacking durable;

    private MutableClock clock;
    private CacheManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        manager = newManager(Map.of(), null);
    }

    @AfterEach
    void tearDown() {
        manager.stopCleanup();
    }

    private CacheManager newManager(Map<String, Long> overrides, DurableCacheBacking backing) {
        return new CacheManager(new CacheStore(100, clock), overrides, Duration.ofMinutes(5), backing);
    }

    @Test
    void metricsStayFreshForTheirTtlAndAreSweptAfter() {
        manager.set("host:web-01:host_metrics", Map.of("load_avg", "0.1"), CacheCategory.HOST_METRICS);

        clock.advanceSeconds(30);
        assertTrue(manager.get("host:web-01:host_metrics", CacheCategory.HOST_METRICS).isPresent());

        clock.advanceSeconds(60);
        assertEquals(1, manager.runCleanup());
        assertTrue(manager.get("host:web-01:host_metrics", CacheCategory.HOST_METRICS).isEmpty());
        assertEquals(0, manager.getStats().entries());
    }

    @Test
    void overridesReplaceCategoryDefaults() {
        CacheManager custom = newManager(Map.of("host_metrics", 5L, "no_such_category", 10L), null);

        assertEquals(5, custom.ttlFor(CacheCategory.HOST_METRICS));
        assertEquals(1800, custom.ttlFor(CacheCategory.HOST_SYSTEM));
    }

    @Test
    void negativeOverrideIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> newManager(Map.of("host_basic", -1L), null));
    }

    @Test
    void explicitTtlWinsAndNegativeIsClamped() {
        manager.set("k", "v", CacheCategory.HOST_SYSTEM, 10);
        manager.set("neg", "v", CacheCategory.HOST_SYSTEM, -5);

        clock.advanceSeconds(10);

        assertTrue(manager.get("k", CacheCategory.HOST_SYSTEM).isEmpty());
        assertTrue(manager.get("neg", CacheCategory.HOST_SYSTEM).isEmpty());
    }

    @Test
    void getOrSetComputesOnce() {
        AtomicInteger calls = new AtomicInteger();

        String first = manager.getOrSet("k", CacheCategory.DEFAULT, () -> "value-" + calls.incrementAndGet());
        String second = manager.getOrSet("k", CacheCategory.DEFAULT, () -> "value-" + calls.incrementAndGet());

        assertEquals("value-1", first);
        assertEquals("value-1", second);
        assertEquals(1, calls.get());
    }

    @Test
    void getOrSetDoesNotCacheNull() {
        assertNull(manager.getOrSet("k", CacheCategory.DEFAULT, () -> null));
        assertEquals(0, manager.getStats().entries());
    }

    @Test
    void clearByCategoryLeavesOthers() {
        manager.set("a", 1, CacheCategory.HOST_BASIC);
        manager.set("b", 2, CacheCategory.HOST_BASIC);
        manager.set("c", 3, CacheCategory.INVENTORY_SEARCH);

        assertEquals(2, manager.clear(CacheCategory.HOST_BASIC));
        assertTrue(manager.get("c", CacheCategory.INVENTORY_SEARCH).isPresent());

        manager.clear();
        assertEquals(0, manager.getStats().entries());
    }

    @Test
    void hostDataIsKeyedCaseInsensitively() {
        manager.cacheHostData("Web-01", Map.of("os", "Linux"), CacheCategory.HOST_SYSTEM);

        assertEquals(Optional.of(Map.of("os", "Linux")), manager.getHostData("WEB-01", CacheCategory.HOST_SYSTEM));
        assertTrue(manager.getHostData("web-01", CacheCategory.HOST_METRICS).isEmpty());
        assertEquals("host:web-01:host_system", CacheManager.hostKey("WEB-01", CacheCategory.HOST_SYSTEM));
    }

    @Test
    void writesThroughAndPromotesFromDurableTier() {
        manager = newManager(Map.of(), durable);
        manager.cacheHostData("web-01", Map.of("os", "Linux"), CacheCategory.HOST_SYSTEM);
        verify(durable).set(eq("web-01"), eq(CacheCategory.HOST_SYSTEM), eq(Map.of("os", "Linux")), eq(1800L));

        when(durable.get("db-01", CacheCategory.HOST_SYSTEM))
                .thenReturn(Optional.of(new DurableCacheEntry(Map.of("os", "BSD"), 1200)));
        assertEquals(Optional.of(Map.of("os", "BSD")), manager.getHostData("db-01", CacheCategory.HOST_SYSTEM));
        assertEquals(Optional.of(Map.of("os", "BSD")), manager.getHostData("db-01", CacheCategory.HOST_SYSTEM));

        verify(durable, times(1)).get("db-01", CacheCategory.HOST_SYSTEM);
    }

    @Test
    void promotedDataExpiresWithTheDurableRow() {
        manager = newManager(Map.of(), durable);
        when(durable.get("web-01", CacheCategory.HOST_METRICS))
                .thenReturn(Optional.of(new DurableCacheEntry(Map.of("load_avg", "0.1"), 10)), Optional.empty());

        // written 50s ago with the 60s metrics TTL, so 10s remain
        assertEquals(Optional.of(Map.of("load_avg", "0.1")), manager.getHostData("web-01", CacheCategory.HOST_METRICS));

        clock.advanceSeconds(9);
        assertTrue(manager.getHostData("web-01", CacheCategory.HOST_METRICS).isPresent());
        verify(durable, times(1)).get("web-01", CacheCategory.HOST_METRICS);

        clock.advanceSeconds(41);
        assertTrue(manager.getHostData("web-01", CacheCategory.HOST_METRICS).isEmpty());
        verify(durable, times(2)).get("web-01", CacheCategory.HOST_METRICS);
    }

    @Test
    void durableRowAtItsLastSecondIsServedButNotPromoted() {
        manager = newManager(Map.of(), durable);
        when(durable.get("web-01", CacheCategory.HOST_BASIC))
                .thenReturn(Optional.of(new DurableCacheEntry(Map.of("ip", "10.0.0.1"), 0)));

        assertTrue(manager.getHostData("web-01", CacheCategory.HOST_BASIC).isPresent());
        assertTrue(manager.getHostData("web-01", CacheCategory.HOST_BASIC).isPresent());

        verify(durable, times(2)).get("web-01", CacheCategory.HOST_BASIC);
        assertEquals(0, manager.getStats().entries());
    }

    @Test
    void durableMissIsRememberedBriefly() {
        manager = newManager(Map.of(), durable);
        when(durable.get("ghost", CacheCategory.HOST_BASIC)).thenReturn(Optional.empty());

        assertTrue(manager.getHostData("ghost", CacheCategory.HOST_BASIC).isEmpty());
        assertTrue(manager.getHostData("ghost", CacheCategory.HOST_BASIC).isEmpty());
        verify(durable, times(1)).get("ghost", CacheCategory.HOST_BASIC);

        clock.advanceSeconds(CacheManager.NO_DATA_TTL_SECONDS);
        assertTrue(manager.getHostData("ghost", CacheCategory.HOST_BASIC).isEmpty());
        verify(durable, times(2)).get("ghost", CacheCategory.HOST_BASIC);
    }

    @Test
    void durableFailuresDegradeToMemoryOnly() {
        manager = newManager(Map.of(), durable);
        doThrow(new IllegalStateException("disk full")).when(durable).set(any(), any(), any(), anyLong());
        when(durable.get(any(), any())).thenThrow(new IllegalStateException("db down"));
        when(durable.getLastKnown(any(), any())).thenThrow(new IllegalStateException("db down"));
        when(durable.purgeExpired()).thenThrow(new IllegalStateException("db down"));

        manager.cacheHostData("web-01", Map.of("os", "Linux"), CacheCategory.HOST_SYSTEM);

        assertEquals(Optional.of(Map.of("os", "Linux")), manager.getHostData("web-01", CacheCategory.HOST_SYSTEM));
        assertTrue(manager.getHostData("db-01", CacheCategory.HOST_SYSTEM).isEmpty());
        assertTrue(manager.getLastKnownHostData("db-01", CacheCategory.HOST_SYSTEM).isEmpty());
        assertEquals(0, manager.runCleanup());
    }

    @Test
    void lastKnownComesFromDurableTier() {
        assertTrue(manager.getLastKnownHostData("web-01", CacheCategory.HOST_SYSTEM).isEmpty());

        manager = newManager(Map.of(), durable);
        when(durable.getLastKnown("web-01", CacheCategory.HOST_SYSTEM)).thenReturn(Optional.of(Map.of("os", "Linux")));

        assertEquals(Optional.of(Map.of("os", "Linux")),
                manager.getLastKnownHostData("web-01", CacheCategory.HOST_SYSTEM));
    }

    @Test
    void invalidateHostDropsEveryCategoryForThatHost() {
        manager = newManager(Map.of(), durable);
        when(durable.clearHost("WEB-01")).thenReturn(2);
        manager.cacheHostData("web-01", Map.of("a", 1), CacheCategory.HOST_BASIC);
        manager.cacheHostData("web-01", Map.of("a", 1), CacheCategory.HOST_SYSTEM);
        manager.cacheHostData("web-010", Map.of("a", 1), CacheCategory.HOST_BASIC);

        assertEquals(4, manager.invalidateHost("WEB-01"));

        assertEquals(1, manager.getStats().entries());
        verify(durable).clearHost("WEB-01");
    }

    @Test
    void inventorySearchResultsAreCachedByLowercasedQuery() {
        manager.cacheInventorySearch("Prod|Web", List.of("web-01", "web-02"));

        Optional<List<String>> hit = manager.getInventorySearch("prod|web");

        assertEquals(Optional.of(List.of("web-01", "web-02")), hit);
        assertTrue(manager.<String>getInventorySearch("staging").isEmpty());
    }

    @Test
    void cleanupStartsAndStopsIdempotently() {
        assertFalse(manager.isCleanupRunning());

        manager.startCleanup();
        manager.startCleanup();
        assertTrue(manager.isCleanupRunning());

        manager.stopCleanup();
        manager.stopCleanup();
        assertFalse(manager.isCleanupRunning());
    }

    @Test
    void cleanupIntervalMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new CacheManager(new CacheStore(10, clock), Map.of(), Duration.ZERO, null));
    }

    @Test
    void sweepAlsoPurgesDurableRows() {
        manager = newManager(Map.of(), durable);

        manager.runCleanup();

        verify(durable).purgeExpired();
        verifyNoMoreInteractions(durable);
    }
}

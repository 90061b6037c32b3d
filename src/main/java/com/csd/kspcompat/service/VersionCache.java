package com.csd.kspcompat.service;

import com.csd.kspcompat.model.KspVersion;
import com.csd.kspcompat.model.VersionCacheStats;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.function.ToIntBiFunction;

/**
 * Memoizes version normalization (keyed by the raw input string) and pairwise comparison
 * (keyed by the ordered operand pair). Safe for concurrent use.
 *
 * <p>Entries are never evicted. With {@code maxEntries > 0} a full map stops accepting new
 * entries; results are still computed, just not stored. The bound is exact under concurrent use.
 */
@Slf4j
public class VersionCache {

    private final boolean enabled;
    private final int maxEntries;

    private final Map<String, KspVersion> normalized = new ConcurrentHashMap<>();
    private final Map<VersionPair, Integer> comparisons = new ConcurrentHashMap<>();

    private final LongAdder normalizationHits = new LongAdder();
    private final LongAdder normalizationMisses = new LongAdder();
    private final LongAdder comparisonHits = new LongAdder();
    private final LongAdder comparisonMisses = new LongAdder();

    public VersionCache() {
        this(true, 0);
    }

    public VersionCache(boolean enabled, int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0, got " + maxEntries);
        }
        this.enabled = enabled;
        this.maxEntries = maxEntries;
    }

    /**
     * Returns the cached value for {@code raw}, computing it on a miss. A {@code null} key is
     * never stored. Exceptions from {@code normalizer} propagate and leave the cache untouched.
     */
    public KspVersion normalized(String raw, Function<String, KspVersion> normalizer) {
        if (raw == null || !enabled) {
            return normalizer.apply(raw);
        }
        KspVersion cached = normalized.get(raw);
        if (cached != null) {
            normalizationHits.increment();
            return cached;
        }
        normalizationMisses.increment();
        log.debug("Normalization cache miss for '{}'", raw);
        return store(normalized, raw, normalizer.apply(raw));
    }

    /**
     * Returns the cached ordering of {@code (first, second)}, computing it on a miss.
     * {@code (second, first)} is a separate entry.
     */
    public int compared(KspVersion first, KspVersion second, ToIntBiFunction<KspVersion, KspVersion> comparator) {
        if (!enabled) {
            return comparator.applyAsInt(first, second);
        }
        VersionPair key = new VersionPair(first, second);
        Integer cached = comparisons.get(key);
        if (cached != null) {
            comparisonHits.increment();
            return cached;
        }
        comparisonMisses.increment();
        log.debug("Comparison cache miss for {} vs {}", first, second);
        return store(comparisons, key, comparator.applyAsInt(first, second));
    }

    private <K, V> V store(Map<K, V> map, K key, V value) {
        if (maxEntries == 0) {
            V existing = map.putIfAbsent(key, value);
            return existing != null ? existing : value;
        }
        // size check and insert must be atomic or concurrent misses overshoot the bound
        synchronized (map) {
            V existing = map.get(key);
            if (existing != null) {
                return existing;
            }
            if (map.size() >= maxEntries) {
                log.debug("Version cache full ({} entries), not storing {}", maxEntries, key);
                return value;
            }
            map.put(key, value);
            return value;
        }
    }

    public VersionCacheStats stats() {
        return VersionCacheStats.builder()
                .enabled(enabled)
                .maxEntries(maxEntries)
                .normalizedEntries(normalized.size())
                .normalizationHits(normalizationHits.sum())
                .normalizationMisses(normalizationMisses.sum())
                .comparisonEntries(comparisons.size())
                .comparisonHits(comparisonHits.sum())
                .comparisonMisses(comparisonMisses.sum())
                .build();
    }

    public void clear() {
        normalized.clear();
        comparisons.clear();
        normalizationHits.reset();
        normalizationMisses.reset();
        comparisonHits.reset();
        comparisonMisses.reset();
        log.debug("Version caches cleared");
    }

    @Value
    private static class VersionPair {
        KspVersion first;
        KspVersion second;
    }
}

package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.exception.KspVersionIncomparableException;
import com.csd.kspcompat.model.KspVersion;
import com.csd.kspcompat.model.VersionCacheStats;
import com.csd.kspcompat.model.VersionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for parsing, ordering and targeting KSP versions. Owns the caches used by
 * all three, so two service instances never share memoized results.
 */
@Slf4j
@Service
public class KspVersionService {

    private final VersionCache cache;
    private final VersionNormalizer normalizer;
    private final VersionComparator comparator;
    private final VersionRangeMatcher matcher;

    public KspVersionService(VersionCache cache) {
        this.cache = cache;
        this.normalizer = new VersionNormalizer(cache);
        this.comparator = new VersionComparator(cache);
        this.matcher = new VersionRangeMatcher(comparator);
    }

    /**
     * Parse a version string. {@code null} and {@code "any"} give the wildcard.
     *
     * @throws BadKspVersionException if the string is not a valid version
     */
    public KspVersion parse(String raw) {
        return normalizer.normalize(raw);
    }

    public VersionOutcome<KspVersion> tryParse(String raw) {
        try {
            return VersionOutcome.success(parse(raw));
        } catch (BadKspVersionException e) {
            return VersionOutcome.malformed(e);
        }
    }

    /**
     * @throws KspVersionIncomparableException if either operand is not a long version
     */
    public int compare(KspVersion a, KspVersion b) {
        return comparator.compare(a, b);
    }

    public VersionOutcome<Integer> tryCompare(KspVersion a, KspVersion b) {
        try {
            return VersionOutcome.success(comparator.compare(a, b));
        } catch (KspVersionIncomparableException e) {
            return VersionOutcome.incomparable(e);
        }
    }

    public boolean isBelow(KspVersion a, KspVersion b) {
        return comparator.isBelow(a, b);
    }

    public boolean isAtMost(KspVersion a, KspVersion b) {
        return comparator.isAtMost(a, b);
    }

    public boolean isAbove(KspVersion a, KspVersion b) {
        return comparator.isAbove(a, b);
    }

    public boolean isAtLeast(KspVersion a, KspVersion b) {
        return comparator.isAtLeast(a, b);
    }

    /**
     * Whether {@code filter} accepts the release {@code candidate}.
     *
     * @throws KspVersionIncomparableException if {@code candidate} is not a long version
     */
    public boolean targets(KspVersion filter, KspVersion candidate) {
        return matcher.targets(filter, candidate);
    }

    public VersionOutcome<Boolean> tryTargets(KspVersion filter, KspVersion candidate) {
        try {
            return VersionOutcome.success(matcher.targets(filter, candidate));
        } catch (KspVersionIncomparableException e) {
            return VersionOutcome.incomparable(e);
        }
    }

    public List<KspVersion> filterTargeted(KspVersion filter, Collection<KspVersion> candidates) {
        return matcher.filterTargeted(filter, candidates);
    }

    public Optional<KspVersion> latestTargeted(KspVersion filter, Collection<KspVersion> candidates) {
        return matcher.latestTargeted(filter, candidates);
    }

    /**
     * Highest long version among {@code versions}. Short versions, the wildcard and nulls are skipped.
     */
    public Optional<KspVersion> highest(Collection<KspVersion> versions) {
        KspVersion best = null;
        for (KspVersion v : versions) {
            if (v == null || !v.isLong()) continue;
            if (best == null || comparator.isAbove(v, best)) {
                best = v;
            }
        }
        return Optional.ofNullable(best);
    }

    public VersionCacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCaches() {
        VersionCacheStats before = cache.stats();
        log.info("Clearing KSP version caches ({} normalized, {} comparisons)",
                before.getNormalizedEntries(), before.getComparisonEntries());
        cache.clear();
    }
}

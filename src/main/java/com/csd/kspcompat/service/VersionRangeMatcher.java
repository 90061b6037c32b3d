package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.KspVersionIncomparableException;
import com.csd.kspcompat.model.KspVersion;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether a version filter from mod metadata accepts a concrete game release.
 * Eg: 0.25 targets 0.25.2, 0.25.2 targets only 0.25.2, any targets everything.
 */
public class VersionRangeMatcher {

    private final VersionComparator comparator;

    public VersionRangeMatcher(VersionComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * @param filter    the version a mod declares, may be short, long or any
     * @param candidate an actual release, must be long
     * @throws KspVersionIncomparableException if {@code candidate} is not a long version
     */
    public boolean targets(KspVersion filter, KspVersion candidate) {
        if (!candidate.isLong()) {
            throw new KspVersionIncomparableException(filter, candidate, "targets");
        }

        if (filter.isAny()) {
            return true;
        }

        // same major.minor as a short filter
        if (filter.isShort() && filter.shortForm().equals(candidate.shortForm())) {
            return true;
        }

        if (filter.isLong()) {
            return comparator.compare(filter, candidate) == 0;
        }

        KspVersion min = filter.toLongMin();
        KspVersion max = filter.toLongMax();
        return comparator.isAtLeast(candidate, min) && comparator.isAtMost(candidate, max);
    }

    /**
     * The candidates accepted by {@code filter}, in their original order.
     */
    public List<KspVersion> filterTargeted(KspVersion filter, Collection<KspVersion> candidates) {
        return candidates.stream()
                .filter(candidate -> targets(filter, candidate))
                .collect(Collectors.toList());
    }

    public Optional<KspVersion> latestTargeted(KspVersion filter, Collection<KspVersion> candidates) {
        return candidates.stream()
                .filter(candidate -> targets(filter, candidate))
                .max(comparator);
    }
}

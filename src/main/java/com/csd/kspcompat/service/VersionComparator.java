package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.KspVersionIncomparableException;
import com.csd.kspcompat.model.KspVersion;

import java.util.Comparator;

/**
 * Cached numeric ordering of long versions.
 *
 * <p>Short versions and the wildcard cannot be ordered directly; expand them with
 * {@link KspVersion#toLongMin()} or {@link KspVersion#toLongMax()} first. Every method passes
 * its operands to the cache in the order the caller gave them.
 */
public class VersionComparator implements Comparator<KspVersion> {

    private final VersionCache cache;

    public VersionComparator(VersionCache cache) {
        this.cache = cache;
    }

    /**
     * @throws KspVersionIncomparableException if either operand is not a long version
     */
    @Override
    public int compare(KspVersion a, KspVersion b) {
        return compare(a, b, "compare");
    }

    public boolean isBelow(KspVersion a, KspVersion b) {
        return compare(a, b, "isBelow") < 0;
    }

    public boolean isAtMost(KspVersion a, KspVersion b) {
        return compare(a, b, "isAtMost") <= 0;
    }

    public boolean isAbove(KspVersion a, KspVersion b) {
        return compare(a, b, "isAbove") > 0;
    }

    public boolean isAtLeast(KspVersion a, KspVersion b) {
        return compare(a, b, "isAtLeast") >= 0;
    }

    private int compare(KspVersion a, KspVersion b, String operation) {
        if (!a.isLong() || !b.isLong()) {
            throw new KspVersionIncomparableException(a, b, operation);
        }
        return cache.compared(a, b, KspVersion::compareTo);
    }
}

package com.csd.kspcompat.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VersionCacheStats {
    private boolean enabled;
    private int maxEntries; // 0 = unbounded
    private int normalizedEntries;
    private long normalizationHits;
    private long normalizationMisses;
    private int comparisonEntries;
    private long comparisonHits;
    private long comparisonMisses;
}

package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.model.KspVersion;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw version strings into {@link KspVersion} values.
 *
 * <p>A leading dot gets a zero prepended ({@code .5} becomes {@code 0.5}); the literal
 * {@code any} and {@code null} both mean the wildcard. Anything else must be a dotted numeric
 * version.
 */
@Slf4j
public class VersionNormalizer {

    private final VersionCache cache;

    public VersionNormalizer(VersionCache cache) {
        this.cache = cache;
    }

    /**
     * @throws BadKspVersionException if {@code raw} is not a valid version
     */
    public KspVersion normalize(String raw) {
        return cache.normalized(raw, VersionNormalizer::normalizeUncached);
    }

    static KspVersion normalizeUncached(String raw) {
        String version = raw;
        if (version != null && version.startsWith(".")) {
            version = "0" + version;
        }
        if (KspVersion.ANY.equals(version)) {
            version = null;
        }
        try {
            return KspVersion.fromCanonical(version);
        } catch (BadKspVersionException e) {
            log.debug("Rejected KSP version '{}'", raw);
            throw e;
        }
    }
}

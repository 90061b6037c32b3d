package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.model.KspVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VersionNormalizerTest {

    private VersionCache cache;
    private VersionNormalizer normalizer;

    @BeforeEach
    void setUp() {
        cache = new VersionCache();
        normalizer = new VersionNormalizer(cache);
    }

    @Test
    void addsLeadingZero() {
        KspVersion version = normalizer.normalize(".5");
        assertEquals("0.5", version.toString());
        assertTrue(version.isShort());

        assertEquals("0.23.5", normalizer.normalize(".23.5").toString());
    }

    @Test
    void anyAndNullAreWildcards() {
        assertTrue(normalizer.normalize("any").isAny());
        assertTrue(normalizer.normalize(null).isAny());
        assertEquals(normalizer.normalize("any"), normalizer.normalize(null));
    }

    @Test
    void onlyExactAnyTokenIsWildcard() {
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("ANY"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize(" any"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize(".any"));
    }

    @Test
    void acceptsMoreThanThreeComponents() {
        KspVersion version = normalizer.normalize("1.2.3.4");
        assertTrue(version.isLong());
        assertEquals("1.2.3.4", version.toString());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("abc"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize(""));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("1"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("1.2."));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("1..2"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("v1.2"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("1.2.3-beta"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize(" 1.2.3"));
    }

    @Test
    void errorCarriesNormalizedString() {
        BadKspVersionException e = assertThrows(BadKspVersionException.class, () -> normalizer.normalize(".x"));
        assertEquals("0.x", e.getVersion());
    }

    @Test
    void roundTripsCanonicalStrings() {
        for (String s : new String[]{"0.25", "0.25.2", "1.0.0", "1.2.3.4", "10.20.30", "0.0"}) {
            assertEquals(s, normalizer.normalize(s).toString());
        }
    }

    @Test
    void cacheIsKeyedByRawInput() {
        KspVersion fromDot = normalizer.normalize(".5");
        KspVersion fromZero = normalizer.normalize("0.5");
        assertEquals(fromDot, fromZero);
        assertEquals(2, cache.stats().getNormalizedEntries());

        assertSame(fromDot, normalizer.normalize(".5"));
        assertEquals(1, cache.stats().getNormalizationHits());
    }

    @Test
    void nullIsNeverCached() {
        normalizer.normalize(null);
        normalizer.normalize(null);
        assertEquals(0, cache.stats().getNormalizedEntries());
        assertEquals(0, cache.stats().getNormalizationMisses());
    }

    @Test
    void rejectedInputIsNotCached() {
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("abc"));
        assertThrows(BadKspVersionException.class, () -> normalizer.normalize("abc"));
        assertEquals(0, cache.stats().getNormalizedEntries());
    }
}

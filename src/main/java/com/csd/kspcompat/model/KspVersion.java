package com.csd.kspcompat.model;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.exception.KspVersionIncomparableException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A KSP game version as used by mod metadata.
 *
 * <p>Three shapes exist:
 * <ul>
 *   <li>the wildcard {@code any}, which matches every release,</li>
 *   <li>a short version {@code major.minor} such as {@code 0.25},</li>
 *   <li>a long version with three or more components such as {@code 0.25.2}.</li>
 * </ul>
 * Instances are immutable. Equality is defined on the canonical string only, so
 * {@code 1.2.3} and {@code 1.2.3.0} are distinct values.
 *
 * <p>Use {@code VersionNormalizer} (or {@code KspVersionService}) to build values from raw user
 * input; {@link #fromCanonical(String)} expects input that already had the leading-dot fix-up applied.
 */
public final class KspVersion implements Comparable<KspVersion> {

    public static final String ANY = "any";

    private static final Pattern SHORT_PATTERN = Pattern.compile("^\\d+\\.\\d+$");
    private static final Pattern LONG_PATTERN = Pattern.compile("^\\d+(\\.\\d+){2,}$");

    private static final String MIN_PATCH = ".0";
    private static final String MAX_PATCH = ".99";

    private static final KspVersion ANY_VERSION = new KspVersion(null, false);

    private final String version; // null for "any"
    private final boolean shortVersion;

    // digits with leading zeros stripped, parsed on first ordering request
    private volatile String[] components;

    private KspVersion(String version, boolean shortVersion) {
        this.version = version;
        this.shortVersion = shortVersion;
    }

    public static KspVersion any() {
        return ANY_VERSION;
    }

    /**
     * Classifies an already normalized version string.
     *
     * @param canonical dotted numeric version, or {@code null} for the wildcard
     * @return the version value
     * @throws BadKspVersionException if the string is not a dotted numeric version
     */
    public static KspVersion fromCanonical(String canonical) {
        if (canonical == null) {
            return ANY_VERSION;
        }
        if (SHORT_PATTERN.matcher(canonical).matches()) {
            return new KspVersion(canonical, true);
        }
        if (LONG_PATTERN.matcher(canonical).matches()) {
            return new KspVersion(canonical, false);
        }
        throw new BadKspVersionException(canonical);
    }

    /**
     * If this version is short ({@code x.y}) returns the lowest release it covers ({@code x.y.0}),
     * otherwise returns this instance. The result must be used; nothing is modified in place.
     */
    public KspVersion toLongMin() {
        return shortVersion ? new KspVersion(version + MIN_PATCH, false) : this;
    }

    /**
     * If this version is short ({@code x.y}) returns {@code x.y.99}, the highest release it is
     * assumed to cover, otherwise returns this instance.
     *
     * <p>The 99 ceiling is a convention, not a real bound: a short version does not reach
     * {@code x.y.100} through this expansion.
     */
    public KspVersion toLongMax() {
        return shortVersion ? new KspVersion(version + MAX_PATCH, false) : this;
    }

    /**
     * The {@code major.minor} prefix of this version.
     *
     * @throws IllegalStateException for the wildcard, which has no prefix
     */
    public String shortForm() {
        if (isAny()) {
            throw new IllegalStateException("The any version has no short form");
        }
        if (shortVersion) {
            return version;
        }
        int firstDot = version.indexOf('.');
        return version.substring(0, version.indexOf('.', firstDot + 1));
    }

    public boolean isAny() {
        return version == null;
    }

    public boolean isNotAny() {
        return !isAny();
    }

    public boolean isShort() {
        return shortVersion;
    }

    public boolean isLong() {
        return version != null && !shortVersion;
    }

    /**
     * @return the canonical version string, {@code null} for the wildcard
     */
    public String getVersion() {
        return version;
    }

    /**
     * Numeric ordering of two long versions, component by component. When one version is a
     * prefix of the other the shorter one orders first. Versions that are numerically equal but
     * spelled differently order by their canonical strings, so {@code compareTo} returns 0
     * only for {@link #equals(Object) equal} versions.
     *
     * @throws KspVersionIncomparableException if either side is short or the wildcard
     */
    @Override
    public int compareTo(KspVersion that) {
        Objects.requireNonNull(that, "Other version cannot be null");
        if (!isLong() || !that.isLong()) {
            throw new KspVersionIncomparableException(this, that, "compareTo");
        }

        String[] mine = components();
        String[] theirs = that.components();
        int shared = Math.min(mine.length, theirs.length);
        for (int i = 0; i < shared; i++) {
            int result = compareNumeric(mine[i], theirs[i]);
            if (result != 0) return result;
        }
        if (mine.length != theirs.length) {
            return Integer.compare(mine.length, theirs.length);
        }
        // numerically equal spellings such as 1.02.3 and 1.2.3 still order apart
        return Integer.signum(version.compareTo(that.version));
    }

    private String[] components() {
        String[] parsed = components;
        if (parsed == null) {
            parsed = version.split("\\.");
            for (int i = 0; i < parsed.length; i++) {
                parsed[i] = stripLeadingZeros(parsed[i]);
            }
            components = parsed;
        }
        return parsed;
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }

    // both arguments are digit strings without leading zeros, so length decides first
    private static int compareNumeric(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return Integer.signum(a.compareTo(b));
    }

    @Override
    public String toString() {
        return version == null ? ANY : version;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Objects.equals(version, ((KspVersion) obj).version);
    }

    @Override
    public int hashCode() {
        return version != null ? version.hashCode() : 0;
    }
}

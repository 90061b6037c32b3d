package com.csd.kspcompat.exception;

import lombok.Getter;

/**
 * Thrown when a version string is neither the "any" wildcard nor a dotted numeric version.
 */
@Getter
public class BadKspVersionException extends IllegalArgumentException {

    private final String version;

    public BadKspVersionException(String version) {
        super(version + " is not a valid KSP version");
        this.version = version;
    }
}

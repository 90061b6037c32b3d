package com.csd.kspcompat.exception;

import lombok.Getter;

/**
 * Thrown when an ordering or targeting check receives an operand that is not a long (x.y.z) version.
 */
@Getter
public class KspVersionIncomparableException extends IllegalStateException {

    private final String version1;
    private final String version2;
    private final String operation;

    public KspVersionIncomparableException(Object version1, Object version2, String operation) {
        super(String.format("%s and %s cannot be compared by %s", version1, version2, operation));
        this.version1 = String.valueOf(version1);
        this.version2 = String.valueOf(version2);
        this.operation = operation;
    }
}

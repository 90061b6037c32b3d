package com.csd.kspcompat.model;

public enum VersionErrorKind {
    MALFORMED_INPUT,        // not "any" and not a dotted numeric version
    INCOMPARABLE_OPERANDS   // ordering or targeting asked for with a short or "any" operand
}

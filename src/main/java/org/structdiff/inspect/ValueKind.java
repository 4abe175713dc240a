package org.structdiff.inspect;

/**
 * Kinds of runtime values the inspector distinguishes.
 */
public enum ValueKind {
    BOOLEAN,
    INTEGER,
    /** Unsigned integral values; {@code char} is the only unsigned primitive in Java. */
    UNSIGNED,
    FLOAT,
    COMPLEX,
    STRING,
    ARRAY,
    SEQUENCE,
    SET,
    MAP,
    /** Pointer-like holder that is either empty or refers to one value. */
    OPTIONAL,
    RECORD,
    /** A value seen through a declared type that is wider than its runtime type. */
    VARIANT,
    ENUM,
    /** JDK value types compared with {@code equals}. */
    VALUE,
    FUNCTION,
    /** Channels, threads and other opaque resources compared by reference. */
    HANDLE;

    /**
     * Composite kinds are the only ones that carry an identity for cycle detection.
     */
    public boolean isComposite() {
        return this == RECORD || this == ARRAY || this == SEQUENCE || this == SET || this == MAP;
    }
}

package org.structdiff.inspect;

import java.util.Objects;

/**
 * Reference identity of an addressable composite value, paired with its type descriptor.
 */
public final class Identity {
    private final Object reference;
    private final Class<?> type;

    Identity(Object reference, Class<?> type) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.type = Objects.requireNonNull(type, "type");
    }

    public Class<?> type() {
        return type;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Identity that)) {
            return false;
        }
        return reference == that.reference && type == that.type;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(reference) + type.hashCode();
    }

    @Override
    public String toString() {
        return type.getSimpleName() + "@0x" + Integer.toHexString(System.identityHashCode(reference));
    }
}

package org.structdiff.inspect;

/**
 * Signals a value the inspector has no strategy for, or a key kind that cannot be matched.
 *
 * <p>This is a programming error: the kind taxonomy must be extended rather than worked around.
 */
public final class UnsupportedKindException extends IllegalStateException {
    private final String typeName;

    public UnsupportedKindException(final String typeName, final String message) {
        super(requireText(message, "message"));
        this.typeName = requireText(typeName, "typeName");
    }

    public UnsupportedKindException(final String typeName, final String message, final Throwable cause) {
        super(requireText(message, "message"), cause);
        this.typeName = requireText(typeName, "typeName");
    }

    public String typeName() {
        return typeName;
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}

package org.structdiff.report;

/**
 * Named comparison between the values two sources hold under the same id.
 */
public final class Comparison {
    private final String id;
    private final String description;

    public Comparison(String id, String description) {
        this.id = requireText(id, "id");
        this.description = description == null ? "" : description.trim();
    }

    public static Comparison of(String id) {
        return new Comparison(id, null);
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}

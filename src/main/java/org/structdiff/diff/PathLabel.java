package org.structdiff.diff;

import java.util.Objects;

/**
 * Immutable path from the comparison root to the current sub-value, e.g. {@code Owner.pets[2]["name"]}.
 */
public final class PathLabel {
    private static final PathLabel ROOT = new PathLabel("");

    private final String text;

    private PathLabel(String text) {
        this.text = text;
    }

    public static PathLabel root() {
        return ROOT;
    }

    public PathLabel field(String name) {
        return child(Objects.requireNonNull(name, "name"));
    }

    public PathLabel index(int index) {
        return child("[" + index + "]");
    }

    public PathLabel key(String renderedKey) {
        return child("[" + Objects.requireNonNull(renderedKey, "renderedKey") + "]");
    }

    public boolean isRoot() {
        return text.isEmpty();
    }

    /**
     * Line prefix for this label: {@code "label: "}, or empty at the root.
     */
    public String prefix() {
        return isRoot() ? "" : text + ": ";
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PathLabel that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    private PathLabel child(String segment) {
        if (!isRoot() && !segment.startsWith("[")) {
            return new PathLabel(text + "." + segment);
        }
        return new PathLabel(text + segment);
    }
}

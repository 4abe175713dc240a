package org.structdiff.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.structdiff.inspect.InspectedValue;
import org.structdiff.inspect.UnsupportedKindException;

/**
 * Pairs up map keys (and set elements) by structural equality using pairwise scans.
 *
 * <p>Only kinds that are legal as keys are accepted. Sequences, sets, maps and functions fail
 * with {@link UnsupportedKindException}.
 */
public final class KeyMatcher {
    private KeyMatcher() {}

    public static boolean keyEqual(InspectedValue left, InspectedValue right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!left.isPresent() && !right.isPresent()) {
            return true;
        }
        if (!left.isPresent() || !right.isPresent() || left.type() != right.type()) {
            return false;
        }
        switch (left.kind()) {
            case BOOLEAN:
            case INTEGER:
            case UNSIGNED:
            case FLOAT:
            case COMPLEX:
            case STRING:
            case VALUE:
            case ENUM:
            case HANDLE:
            case OPTIONAL:
                return Scalars.equal(left, right);
            case ARRAY:
                int length = left.length();
                if (length != right.length()) {
                    return false;
                }
                for (int i = 0; i < length; i++) {
                    if (!keyEqual(left.index(i), right.index(i))) {
                        return false;
                    }
                }
                return true;
            case VARIANT:
                return keyEqual(left.elem(), right.elem());
            case RECORD:
                for (int i = 0; i < left.fieldCount(); i++) {
                    if (!keyEqual(left.field(i), right.field(i))) {
                        return false;
                    }
                }
                return true;
            default:
                throw new UnsupportedKindException(left.typeName(), "invalid map key type " + left.typeName());
        }
    }

    /**
     * Splits two key lists into left-only keys, matched pairs and right-only keys. Each left key
     * pairs with the first key-equal right key; result lists keep input order.
     */
    public static Partition partition(List<InspectedValue> leftKeys, List<InspectedValue> rightKeys) {
        Objects.requireNonNull(leftKeys, "leftKeys");
        Objects.requireNonNull(rightKeys, "rightKeys");
        List<InspectedValue> onlyLeft = new ArrayList<>();
        List<Match> both = new ArrayList<>();
        List<InspectedValue> onlyRight = new ArrayList<>();
        for (InspectedValue left : leftKeys) {
            InspectedValue match = findEqual(left, rightKeys);
            if (match == null) {
                onlyLeft.add(left);
            } else {
                both.add(new Match(left, match));
            }
        }
        for (InspectedValue right : rightKeys) {
            if (findEqual(right, leftKeys) == null) {
                onlyRight.add(right);
            }
        }
        return new Partition(onlyLeft, both, onlyRight);
    }

    private static InspectedValue findEqual(InspectedValue key, List<InspectedValue> candidates) {
        for (InspectedValue candidate : candidates) {
            if (keyEqual(key, candidate)) {
                return candidate;
            }
        }
        return null;
    }

    public record Match(InspectedValue left, InspectedValue right) {}

    public record Partition(List<InspectedValue> onlyLeft, List<Match> both, List<InspectedValue> onlyRight) {
        public Partition {
            onlyLeft = List.copyOf(onlyLeft);
            both = List.copyOf(both);
            onlyRight = List.copyOf(onlyRight);
        }
    }
}

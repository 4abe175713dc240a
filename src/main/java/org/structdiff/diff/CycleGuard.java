package org.structdiff.diff;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.structdiff.inspect.Identity;

/**
 * Per-comparison record of which left identity was paired with which right identity.
 *
 * <p>One instance serves a single top-level comparison and is never shared.
 */
final class CycleGuard {
    enum Visit {
        FIRST,
        CONSISTENT_REVISIT,
        LEFT_PAIRED_ELSEWHERE,
        RIGHT_PAIRED_ELSEWHERE
    }

    private final Map<Identity, Identity> leftVisited = new HashMap<>();
    private final Map<Identity, Identity> rightVisited = new HashMap<>();

    /**
     * Classifies the pairing of {@code left} with {@code right} and records it as the latest one.
     */
    Visit visit(Identity left, Identity right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Visit visit;
        Identity previous = leftVisited.get(left);
        if (previous != null) {
            visit = previous.equals(right) ? Visit.CONSISTENT_REVISIT : Visit.LEFT_PAIRED_ELSEWHERE;
        } else if (rightVisited.containsKey(right)) {
            visit = Visit.RIGHT_PAIRED_ELSEWHERE;
        } else {
            visit = Visit.FIRST;
        }
        leftVisited.put(left, right);
        rightVisited.put(right, left);
        return visit;
    }

    int size() {
        return leftVisited.size();
    }
}

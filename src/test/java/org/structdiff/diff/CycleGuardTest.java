package org.structdiff.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.structdiff.inspect.Identity;
import org.structdiff.inspect.ValueInspector;

class CycleGuardTest {
    private final ValueInspector inspector = new ValueInspector();

    @Test
    void classifiesFirstAndConsistentVisits() {
        CycleGuard guard = new CycleGuard();
        Identity left = identityOf(new ArrayList<>());
        Identity right = identityOf(new ArrayList<>());

        assertEquals(CycleGuard.Visit.FIRST, guard.visit(left, right));
        assertEquals(CycleGuard.Visit.CONSISTENT_REVISIT, guard.visit(left, right));
        assertEquals(1, guard.size());
    }

    @Test
    void detectsPairingChangesOnEitherSide() {
        CycleGuard guard = new CycleGuard();
        Identity left = identityOf(new ArrayList<>());
        Identity right = identityOf(new ArrayList<>());
        Identity other = identityOf(new ArrayList<>());

        guard.visit(left, right);

        assertEquals(CycleGuard.Visit.LEFT_PAIRED_ELSEWHERE, guard.visit(left, other));
        assertEquals(CycleGuard.Visit.RIGHT_PAIRED_ELSEWHERE, guard.visit(identityOf(new ArrayList<>()), other));
    }

    @Test
    void identityIsReferenceBased() {
        List<Integer> list = new ArrayList<>(List.of(1));

        assertEquals(identityOf(list), identityOf(list));
        assertEquals(false, identityOf(list).equals(identityOf(new ArrayList<>(List.of(1)))));
    }

    private Identity identityOf(Object composite) {
        return inspector.inspect(composite).elem().identity().orElseThrow();
    }
}

package org.structdiff.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PathLabelTest {
    @Test
    void omitsDotAtRootAndBeforeBrackets() {
        PathLabel label = PathLabel.root().field("Owner").field("pets").index(2).key("\"name\"").field("First");

        assertEquals("Owner.pets[2][\"name\"].First", label.toString());
        assertEquals("[0]", PathLabel.root().index(0).toString());
        assertEquals("[\"k\"].v", PathLabel.root().key("\"k\"").field("v").toString());
    }

    @Test
    void derivingChildLeavesParentUnchanged() {
        PathLabel parent = PathLabel.root().field("a");
        PathLabel first = parent.field("b");
        PathLabel second = parent.index(1);

        assertEquals("a", parent.toString());
        assertEquals("a.b", first.toString());
        assertEquals("a[1]", second.toString());
    }

    @Test
    void prefixIsEmptyAtRoot() {
        assertTrue(PathLabel.root().isRoot());
        assertEquals("", PathLabel.root().prefix());
        assertEquals("x: ", PathLabel.root().field("x").prefix());
    }
}

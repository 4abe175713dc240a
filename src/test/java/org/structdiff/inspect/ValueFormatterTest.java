package org.structdiff.inspect;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ValueFormatterTest {
    private final ValueInspector inspector = new ValueInspector();

    @Test
    void rendersLeavesInLiteralStyle() {
        assertEquals("1", render(1));
        assertEquals("true", render(true));
        assertEquals("2.5", render(2.5));
        assertEquals("'x'", render('x'));
        assertEquals("\"hi\"", render("hi"));
        assertEquals("(0.0+1.0i)", render(Complex.of(0, 1)));
        assertEquals("2024-01-02", render(LocalDate.of(2024, 1, 2)));
        assertEquals("Color.GREEN", render(Color.GREEN));
        assertEquals("null", render(null));
    }

    @Test
    void escapesControlCharactersAndDelimiters() {
        assertEquals("\"a\\\"b\\\\c\\t\"", ValueFormatter.quote("a\"b\\c\t"));
        assertEquals("\"\\u0001\"", ValueFormatter.quote("\u0001"));
        assertEquals("'\\''", ValueFormatter.quote('\''));
        assertEquals("'\"'", ValueFormatter.quote('"'));
    }

    @Test
    void rendersContainers() {
        assertEquals("int[]{1, 2}", render(new int[] {1, 2}));
        assertEquals("[1, \"b\"]", render(List.of(1, "b")));
        assertEquals("Set[3]", render(Set.of(3)));
        assertEquals("{\"a\": 1}", render(Map.of("a", 1)));
        assertEquals("Optional.empty", render(Optional.empty()));
        assertEquals("Optional[[1]]", render(Optional.of(List.of(1))));
        assertEquals("Point{x: 1, name: \"n\"}", render(new Point(1, "n")));
    }

    @Test
    void cutsSelfReferencesShort() {
        List<Object> list = new ArrayList<>();
        list.add(1);
        list.add(list);

        assertEquals("[1, List{...}]", render(list));
    }

    @Test
    void repeatedButAcyclicReferencesRenderInFull() {
        List<Integer> shared = List.of(7);

        assertEquals("[[7], [7]]", render(List.of(shared, shared)));
    }

    @Test
    void namesTypes() {
        assertEquals("String", ValueFormatter.typeName(String.class));
        assertEquals("List", ValueFormatter.typeName(List.class));
        assertEquals("int[][]", ValueFormatter.typeName(int[][].class));
        assertEquals("java.time.LocalDate", ValueFormatter.typeName(LocalDate.class));
        assertEquals("org.structdiff.inspect.ValueFormatterTest.Point", ValueFormatter.typeName(Point.class));
    }

    private String render(Object value) {
        return ValueFormatter.render(inspector.inspect(value));
    }

    private enum Color {
        GREEN
    }

    private record Point(int x, String name) {}
}

package org.structdiff.diff;

import java.util.Objects;
import java.util.Optional;
import org.structdiff.inspect.Identity;
import org.structdiff.inspect.InspectedValue;
import org.structdiff.inspect.UnsupportedKindException;
import org.structdiff.inspect.ValueFormatter;
import org.structdiff.inspect.ValueInspector;
import org.structdiff.sink.DiffPrinter;

/**
 * Walks two values in lockstep and prints one line per point of disagreement.
 *
 * <p>The differ is stateless; every call to {@link #diff(DiffPrinter, Object, Object)} gets its
 * own {@link CycleGuard}, so concurrent calls on independent values do not interfere.
 *
 * <p>Cycles are only detected through addressable values. Map keys, map values and set
 * elements are not addressable, so a map that contains itself as a value recurses until the
 * stack is exhausted.
 */
public final class StructuralDiffer {
    private final ValueInspector inspector;

    public StructuralDiffer() {
        this(new ValueInspector());
    }

    public StructuralDiffer(ValueInspector inspector) {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
    }

    public void diff(DiffPrinter printer, Object left, Object right) {
        Objects.requireNonNull(printer, "printer");
        new Walk(printer).diff(PathLabel.root(), inspector.inspect(left), inspector.inspect(right));
    }

    private static final class Walk {
        private final DiffPrinter printer;
        private final CycleGuard guard = new CycleGuard();

        private Walk(DiffPrinter printer) {
            this.printer = printer;
        }

        private void printf(PathLabel label, String format, Object... args) {
            printer.printf(label.prefix().replace("%", "%%") + format, args);
        }

        private void diff(PathLabel label, InspectedValue left, InspectedValue right) {
            if (!left.isPresent() && right.isPresent()) {
                printf(label, "null != %s", render(right));
                return;
            }
            if (left.isPresent() && !right.isPresent()) {
                printf(label, "%s != null", render(left));
                return;
            }
            if (!left.isPresent()) {
                return;
            }

            if (left.type() != right.type()) {
                printf(label, "%s != %s", left.typeName(), right.typeName());
                return;
            }

            Optional<Identity> leftIdentity = left.identity();
            Optional<Identity> rightIdentity = right.identity();
            if (leftIdentity.isPresent() && rightIdentity.isPresent()) {
                switch (guard.visit(leftIdentity.get(), rightIdentity.get())) {
                    case LEFT_PAIRED_ELSEWHERE -> {
                        printf(label, "%s (previously visited) != %s", render(left), render(right));
                        return;
                    }
                    case RIGHT_PAIRED_ELSEWHERE -> {
                        printf(label, "%s != %s (previously visited)", render(left), render(right));
                        return;
                    }
                    case CONSISTENT_REVISIT -> {
                        return;
                    }
                    case FIRST -> {
                        // compare below
                    }
                }
            }

            switch (left.kind()) {
                case BOOLEAN, INTEGER, UNSIGNED, FLOAT, COMPLEX, STRING, ENUM, VALUE -> {
                    if (!Scalars.equal(left, right)) {
                        printf(label, "%s != %s", render(left), render(right));
                    }
                }
                case FUNCTION, HANDLE -> {
                    if (left.raw() != right.raw()) {
                        printf(label, "0x%x != 0x%x", left.address(), right.address());
                    }
                }
                case ARRAY -> diffElements(label, left, right, ValueFormatter.typeName(left.type().getComponentType()));
                case SEQUENCE -> diffElements(label, left, right, left.typeName());
                case RECORD -> {
                    for (int i = 0; i < left.fieldCount(); i++) {
                        diff(label.field(left.fieldName(i)), left.field(i), right.field(i));
                    }
                }
                case OPTIONAL -> {
                    if (left.isNil() && !right.isNil()) {
                        printf(label, "null != %s", render(right));
                    } else if (!left.isNil() && right.isNil()) {
                        printf(label, "%s != null", render(left));
                    } else if (!left.isNil()) {
                        diff(label, left.elem(), right.elem());
                    }
                }
                case VARIANT -> diff(label, left.elem(), right.elem());
                case MAP -> diffMap(label, left, right);
                case SET -> diffSet(label, left, right);
                default -> throw new UnsupportedKindException(left.typeName(), "unknown value kind " + left.kind());
            }
        }

        private void diffElements(PathLabel label, InspectedValue left, InspectedValue right, String elementTypeName) {
            int leftLength = left.length();
            int rightLength = right.length();
            if (leftLength != rightLength) {
                printf(label, "%s[%d] != %s[%d]", elementTypeName, leftLength, elementTypeName, rightLength);
                return;
            }
            for (int i = 0; i < leftLength; i++) {
                diff(label.index(i), left.index(i), right.index(i));
            }
        }

        private void diffMap(PathLabel label, InspectedValue left, InspectedValue right) {
            KeyMatcher.Partition partition = KeyMatcher.partition(left.mapKeys(), right.mapKeys());
            for (InspectedValue key : partition.onlyLeft()) {
                printf(label.key(render(key)), "%s != (missing)", render(left.mapIndex(key)));
            }
            for (KeyMatcher.Match match : partition.both()) {
                diff(label.key(render(match.left())), left.mapIndex(match.left()), right.mapIndex(match.right()));
            }
            for (InspectedValue key : partition.onlyRight()) {
                printf(label.key(render(key)), "(missing) != %s", render(right.mapIndex(key)));
            }
        }

        private void diffSet(PathLabel label, InspectedValue left, InspectedValue right) {
            KeyMatcher.Partition partition = KeyMatcher.partition(left.setElements(), right.setElements());
            for (InspectedValue element : partition.onlyLeft()) {
                printf(label, "%s != (missing)", render(element));
            }
            for (InspectedValue element : partition.onlyRight()) {
                printf(label, "(missing) != %s", render(element));
            }
        }

        private static String render(InspectedValue value) {
            return ValueFormatter.render(value);
        }
    }
}

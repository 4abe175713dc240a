package org.structdiff.diff;

import org.structdiff.inspect.Complex;
import org.structdiff.inspect.InspectedValue;

/**
 * Exact equality for leaf kinds. Both values must be present and of the same type.
 */
final class Scalars {
    private Scalars() {}

    static boolean equal(InspectedValue left, InspectedValue right) {
        switch (left.kind()) {
            case BOOLEAN:
                return left.booleanValue() == right.booleanValue();
            case INTEGER:
                return left.integerValue().equals(right.integerValue());
            case UNSIGNED:
                return left.unsignedValue() == right.unsignedValue();
            case FLOAT:
                if (left.isDecimal()) {
                    return left.decimalValue().compareTo(right.decimalValue()) == 0;
                }
                return left.floatValue() == right.floatValue();
            case COMPLEX:
                Complex a = left.complexValue();
                Complex b = right.complexValue();
                return a.real() == b.real() && a.imaginary() == b.imaginary();
            case STRING:
                return left.stringValue().equals(right.stringValue());
            case VALUE:
                return left.raw().equals(right.raw());
            case ENUM:
            case FUNCTION:
            case HANDLE:
            case OPTIONAL:
                return left.raw() == right.raw();
            default:
                throw new IllegalArgumentException("not a leaf kind: " + left.kind());
        }
    }
}

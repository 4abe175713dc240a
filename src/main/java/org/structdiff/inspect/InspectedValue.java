package org.structdiff.inspect;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.Set;

/**
 * Handle over one runtime value plus its type descriptor, kind and addressability.
 *
 * <p>Sub-values (fields, elements, map entries, optional contents) are inspected on demand.
 * Accessors that do not apply to the value's kind throw {@link IllegalStateException}.
 */
public final class InspectedValue {
    private final ValueInspector inspector;
    private final Object value;
    private final Class<?> type;
    private final ValueKind kind;
    private final boolean addressable;
    private final InspectedValue concrete;
    private List<?> elements;

    InspectedValue(
        ValueInspector inspector,
        Object value,
        Class<?> type,
        ValueKind kind,
        boolean addressable,
        InspectedValue concrete
    ) {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.value = value;
        this.type = Objects.requireNonNull(type, "type");
        this.kind = kind;
        this.addressable = addressable;
        this.concrete = concrete;
    }

    static InspectedValue absent(ValueInspector inspector, Class<?> declaredType) {
        return new InspectedValue(inspector, null, declaredType, null, false, null);
    }

    public boolean isPresent() {
        return value != null;
    }

    public ValueKind kind() {
        requirePresent();
        return kind;
    }

    /**
     * Type descriptor; for absent values this is the declared type of the slot.
     */
    public Class<?> type() {
        return type;
    }

    public String typeName() {
        return ValueFormatter.typeName(type);
    }

    public Object raw() {
        return value;
    }

    public boolean isAddressable() {
        return addressable;
    }

    /**
     * Identity used for cycle detection, defined only for addressable, non-empty composite values.
     *
     * <p>Empty containers cannot close a cycle, and the JDK shares a single instance for empty
     * immutable collections, so they carry no identity.
     */
    public Optional<Identity> identity() {
        if (!isPresent() || !addressable || !kind.isComposite() || isEmptyContainer()) {
            return Optional.empty();
        }
        return Optional.of(new Identity(value, type));
    }

    /**
     * Identity hash of the referenced object, used to render handles and functions.
     */
    public int address() {
        requirePresent();
        return System.identityHashCode(value);
    }

    public boolean booleanValue() {
        requireKind(ValueKind.BOOLEAN);
        return (Boolean) value;
    }

    public BigInteger integerValue() {
        requireKind(ValueKind.INTEGER);
        if (value instanceof BigInteger big) {
            return big;
        }
        return BigInteger.valueOf(((Number) value).longValue());
    }

    public char unsignedValue() {
        requireKind(ValueKind.UNSIGNED);
        return (Character) value;
    }

    /**
     * Floating value as a {@code double}; not defined for {@link BigDecimal} values.
     */
    public double floatValue() {
        requireKind(ValueKind.FLOAT);
        if (value instanceof BigDecimal) {
            throw new IllegalStateException("decimal value has no exact double form: " + value);
        }
        return ((Number) value).doubleValue();
    }

    public boolean isDecimal() {
        return value instanceof BigDecimal;
    }

    public BigDecimal decimalValue() {
        requireKind(ValueKind.FLOAT);
        if (!(value instanceof BigDecimal decimal)) {
            throw new IllegalStateException("not a decimal value: " + typeName());
        }
        return decimal;
    }

    public Complex complexValue() {
        requireKind(ValueKind.COMPLEX);
        return (Complex) value;
    }

    public String stringValue() {
        requireKind(ValueKind.STRING);
        return (String) value;
    }

    public int length() {
        requirePresent();
        if (kind == ValueKind.ARRAY) {
            return Array.getLength(value);
        }
        if (kind == ValueKind.SEQUENCE) {
            return elements().size();
        }
        throw wrongKind("length");
    }

    /**
     * Element {@code i} of an array or sequence. Elements are addressable.
     */
    public InspectedValue index(int i) {
        requirePresent();
        if (kind == ValueKind.ARRAY) {
            return inspector.inspect(Array.get(value, i), type.getComponentType(), true);
        }
        if (kind == ValueKind.SEQUENCE) {
            return inspector.inspect(elements().get(i), Object.class, true);
        }
        throw wrongKind("index");
    }

    public int fieldCount() {
        requireKind(ValueKind.RECORD);
        return inspector.fieldsOf(type).size();
    }

    public String fieldName(int i) {
        requireKind(ValueKind.RECORD);
        return inspector.fieldsOf(type).get(i).getName();
    }

    public InspectedValue field(int i) {
        requireKind(ValueKind.RECORD);
        Field field = inspector.fieldsOf(type).get(i);
        Object fieldValue;
        try {
            fieldValue = field.get(value);
        } catch (IllegalAccessException e) {
            throw new UnsupportedKindException(typeName(), "cannot read field " + field.getName() + " of " + typeName(), e);
        }
        return inspector.inspect(fieldValue, field.getType(), true);
    }

    /**
     * Keys in the map's iteration order. Keys have no stable address.
     */
    public List<InspectedValue> mapKeys() {
        requireKind(ValueKind.MAP);
        Map<?, ?> map = (Map<?, ?>) value;
        List<InspectedValue> keys = new ArrayList<>(map.size());
        for (Object key : map.keySet()) {
            keys.add(inspector.inspect(key, Object.class, false));
        }
        return keys;
    }

    /**
     * Value stored under a key obtained from {@link #mapKeys()}. Map values have no stable address.
     */
    public InspectedValue mapIndex(InspectedValue key) {
        requireKind(ValueKind.MAP);
        Objects.requireNonNull(key, "key");
        return inspector.inspect(((Map<?, ?>) value).get(key.raw()), Object.class, false);
    }

    public List<InspectedValue> setElements() {
        requireKind(ValueKind.SET);
        Set<?> set = (Set<?>) value;
        List<InspectedValue> members = new ArrayList<>(set.size());
        for (Object member : set) {
            members.add(inspector.inspect(member, Object.class, false));
        }
        return members;
    }

    /**
     * True for an empty {@link Optional}.
     */
    public boolean isNil() {
        requireKind(ValueKind.OPTIONAL);
        return ((Optional<?>) value).isEmpty();
    }

    /**
     * Contents of a present optional, or the concrete value held by a variant.
     */
    public InspectedValue elem() {
        requirePresent();
        if (kind == ValueKind.VARIANT) {
            return concrete;
        }
        if (kind == ValueKind.OPTIONAL) {
            return inspector.inspect(((Optional<?>) value).orElse(null), Object.class, true);
        }
        throw wrongKind("elem");
    }

    @Override
    public String toString() {
        return ValueFormatter.render(this);
    }

    private List<?> elements() {
        if (elements == null) {
            if (value instanceof List<?> list && value instanceof RandomAccess) {
                elements = list;
            } else {
                elements = new ArrayList<>((Collection<?>) value);
            }
        }
        return elements;
    }

    private boolean isEmptyContainer() {
        switch (kind) {
            case ARRAY:
                return Array.getLength(value) == 0;
            case SEQUENCE:
            case SET:
                return ((Collection<?>) value).isEmpty();
            case MAP:
                return ((Map<?, ?>) value).isEmpty();
            default:
                return false;
        }
    }

    private void requirePresent() {
        if (value == null) {
            throw new IllegalStateException("value is absent");
        }
    }

    private void requireKind(ValueKind expected) {
        requirePresent();
        if (kind != expected) {
            throw new IllegalStateException("expected " + expected + " but was " + kind + " (" + typeName() + ")");
        }
    }

    private IllegalStateException wrongKind(String accessor) {
        return new IllegalStateException(accessor + " is not defined for " + kind + " (" + typeName() + ")");
    }
}

package org.structdiff.inspect;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reflective inspector that classifies arbitrary Java values into {@link ValueKind}s.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class ValueInspector {
    private static final ClassValue<List<Field>> FIELDS = new ClassValue<>() {
        @Override
        protected List<Field> computeValue(Class<?> type) {
            return List.copyOf(accessibleFields(type));
        }
    };

    /**
     * Inspects a comparison root. Roots are seen through {@code Object} and are addressable.
     */
    public InspectedValue inspect(Object value) {
        return inspect(value, Object.class, true);
    }

    /**
     * Inspects a value reached through a slot declared as {@code staticType}.
     *
     * <p>When the declared type is open to subtypes, or differs from the value's nominal type,
     * the result is a {@link ValueKind#VARIANT} holding the concrete value.
     */
    public InspectedValue inspect(Object value, Class<?> staticType, boolean addressable) {
        Class<?> declared = box(staticType == null ? Object.class : staticType);
        if (value == null) {
            return InspectedValue.absent(this, declared);
        }
        Classification classification = classify(value);
        if (canVary(declared) || declared != classification.nominalType()) {
            InspectedValue concrete = new InspectedValue(
                this,
                value,
                classification.nominalType(),
                classification.kind(),
                addressable,
                null
            );
            return new InspectedValue(this, value, declared, ValueKind.VARIANT, addressable, concrete);
        }
        return new InspectedValue(this, value, declared, classification.kind(), addressable, null);
    }

    List<Field> fieldsOf(Class<?> type) {
        return FIELDS.get(type);
    }

    /**
     * Whether a slot of this declared type can hold values of more than one nominal type. The
     * answer depends on the declared type only, so both sides of a comparison agree on it.
     */
    private static boolean canVary(Class<?> declared) {
        if (declared.isArray()) {
            Class<?> component = declared.getComponentType();
            return !component.isPrimitive() && canVary(component);
        }
        return !Modifier.isFinal(declared.getModifiers());
    }

    private static Classification classify(Object value) {
        Class<?> type = value.getClass();
        if (value instanceof Boolean) {
            return new Classification(ValueKind.BOOLEAN, type);
        }
        if (value instanceof Byte
            || value instanceof Short
            || value instanceof Integer
            || value instanceof Long
            || value instanceof BigInteger
            || value instanceof AtomicInteger
            || value instanceof AtomicLong) {
            return new Classification(ValueKind.INTEGER, type);
        }
        if (value instanceof Character) {
            return new Classification(ValueKind.UNSIGNED, type);
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return new Classification(ValueKind.FLOAT, type);
        }
        if (value instanceof Complex) {
            return new Classification(ValueKind.COMPLEX, type);
        }
        if (value instanceof String) {
            return new Classification(ValueKind.STRING, type);
        }
        if (type.isArray()) {
            return new Classification(ValueKind.ARRAY, type);
        }
        if (value instanceof Enum<?> constant) {
            return new Classification(ValueKind.ENUM, constant.getDeclaringClass());
        }
        if (value instanceof Optional<?>) {
            return new Classification(ValueKind.OPTIONAL, Optional.class);
        }
        if (value instanceof Map<?, ?>) {
            return new Classification(ValueKind.MAP, Map.class);
        }
        if (value instanceof Set<?>) {
            return new Classification(ValueKind.SET, Set.class);
        }
        if (value instanceof BlockingQueue<?>) {
            return new Classification(ValueKind.HANDLE, BlockingQueue.class);
        }
        if (value instanceof List<?>) {
            return new Classification(ValueKind.SEQUENCE, List.class);
        }
        if (value instanceof Collection<?>) {
            return new Classification(ValueKind.SEQUENCE, Collection.class);
        }
        if (type.isSynthetic() || type.isHidden() || type.isAnonymousClass()) {
            return new Classification(ValueKind.FUNCTION, functionType(type));
        }
        if (value instanceof Thread || value instanceof Executor || value instanceof AutoCloseable) {
            return new Classification(ValueKind.HANDLE, type);
        }
        if (type.isRecord()) {
            return new Classification(ValueKind.RECORD, type);
        }
        if (isPlatformType(type)) {
            if (value instanceof Comparable<?> || overridesEquals(type)) {
                return new Classification(ValueKind.VALUE, type);
            }
            throw new UnsupportedKindException(
                ValueFormatter.typeName(type),
                "unknown value kind for type " + ValueFormatter.typeName(type)
            );
        }
        return new Classification(ValueKind.RECORD, type);
    }

    /**
     * Whether {@code type} belongs to the Java platform rather than to application code, which may
     * itself live in named modules on the module path.
     */
    static boolean isPlatformType(Class<?> type) {
        ClassLoader loader = type.getClassLoader();
        if (loader == null || loader == ClassLoader.getPlatformClassLoader()) {
            return true;
        }
        String moduleName = type.getModule().getName();
        return moduleName != null && (moduleName.startsWith("java.") || moduleName.startsWith("jdk."));
    }

    private static Class<?> functionType(Class<?> type) {
        Class<?>[] interfaces = type.getInterfaces();
        if (interfaces.length > 0) {
            return interfaces[0];
        }
        Class<?> superclass = type.getSuperclass();
        return superclass == null ? type : superclass;
    }

    private static boolean overridesEquals(Class<?> type) {
        try {
            return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            throw new UnsupportedKindException(ValueFormatter.typeName(type), "no equals method on " + type, e);
        }
    }

    private static List<Field> accessibleFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                try {
                    fields.add(open(type.getDeclaredField(component.getName())));
                } catch (NoSuchFieldException e) {
                    throw new UnsupportedKindException(
                        ValueFormatter.typeName(type),
                        "record component without backing field: " + component.getName(),
                        e
                    );
                }
            }
            return fields;
        }
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            if (current != type && isPlatformType(current)) {
                break;
            }
            hierarchy.add(0, current);
        }
        for (Class<?> declaring : hierarchy) {
            for (Field field : declaring.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                fields.add(open(field));
            }
        }
        return fields;
    }

    private static Field open(Field field) {
        try {
            field.setAccessible(true);
            return field;
        } catch (InaccessibleObjectException | SecurityException e) {
            throw new UnsupportedKindException(
                ValueFormatter.typeName(field.getDeclaringClass()),
                "cannot inspect field " + field.getName() + " of " + field.getDeclaringClass().getName(),
                e
            );
        }
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        return type;
    }

    private record Classification(ValueKind kind, Class<?> nominalType) {}
}

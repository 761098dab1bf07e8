package com.stepflow.stepinterface;

import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Checks plain values against declared types and coerces accepted values to the Java type of
 * the entrypoint parameter. Integral values are range-checked; maps are accepted for concrete
 * bean types and bound with Jackson; strings are accepted for enum types.
 */
public final class InputTypeChecker {

    private InputTypeChecker() {
    }

    public static boolean accepts(DeclaredType type, Object value) {
        if (type instanceof DeclaredType.AnyType) return true;
        if (type instanceof DeclaredType.NoneType) return value == null;
        if (type instanceof DeclaredType.Union) {
            for (DeclaredType member : type.members()) {
                if (accepts(member, value)) return true;
            }
            return false;
        }
        if (value == null) return false;
        if (type instanceof DeclaredType.Scalar) {
            return acceptsScalar(((DeclaredType.Scalar) type).kind(), value);
        }
        Class<?> target = type.javaType();
        if (target.isInstance(value)) return true;
        if (target.isEnum() && value instanceof String) {
            for (Object constant : target.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(value)) return true;
            }
            return false;
        }
        return value instanceof Map && isBeanLike(target);
    }

    /**
     * Validates a value passed for a step input.
     *
     * @throws StepInterfaceException naming the step, input and expected type when the value is rejected
     */
    public static void validateInput(String stepName, String inputName, DeclaredType type, Object value) {
        if (!accepts(type, value)) {
            throw new StepInterfaceException("Invalid value for input '" + inputName + "' of step '" + stepName
                    + "': expected " + type.describe() + ", got "
                    + (value == null ? "null" : value.getClass().getName()));
        }
    }

    /** Converts an accepted value to the entrypoint parameter type (numbers, enums, beans from maps). */
    public static Object coerce(Class<?> javaType, Object value) {
        if (value == null) {
            if (javaType.isPrimitive()) {
                throw new StepInterfaceException("Cannot pass null for primitive parameter of type " + javaType.getName());
            }
            return null;
        }
        Class<?> boxed = StepInterfaceAnalyzer.boxed(javaType);
        if (boxed.isInstance(value)) return value;
        if (value instanceof Number && Number.class.isAssignableFrom(boxed)) {
            return convertNumber((Number) value, boxed);
        }
        return JsonValues.convert(value, boxed);
    }

    private static boolean acceptsScalar(ScalarKind kind, Object value) {
        switch (kind) {
            case STRING:
                return value instanceof String;
            case BOOLEAN:
                return value instanceof Boolean;
            case CHARACTER:
                return value instanceof Character || (value instanceof String && ((String) value).length() == 1);
            default:
                break;
        }
        if (!(value instanceof Number)) return false;
        if (kind.isFloating()) return true;
        if (!isIntegralValue((Number) value)) return false;
        BigInteger v = toBigInteger((Number) value);
        switch (kind) {
            case BYTE:
                return inRange(v, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case SHORT:
                return inRange(v, Short.MIN_VALUE, Short.MAX_VALUE);
            case INTEGER:
                return inRange(v, Integer.MIN_VALUE, Integer.MAX_VALUE);
            default:
                return inRange(v, Long.MIN_VALUE, Long.MAX_VALUE);
        }
    }

    private static boolean isIntegralValue(Number n) {
        return n instanceof Byte || n instanceof Short || n instanceof Integer
                || n instanceof Long || n instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(n.longValue());
    }

    private static boolean inRange(BigInteger v, long min, long max) {
        return v.compareTo(BigInteger.valueOf(min)) >= 0 && v.compareTo(BigInteger.valueOf(max)) <= 0;
    }

    private static Object convertNumber(Number n, Class<?> target) {
        if (target == Byte.class) return n.byteValue();
        if (target == Short.class) return n.shortValue();
        if (target == Integer.class) return n.intValue();
        if (target == Long.class) return n.longValue();
        if (target == Float.class) return n.floatValue();
        if (target == Double.class) return n.doubleValue();
        if (target == BigInteger.class) return toBigInteger(n);
        if (target == BigDecimal.class) return new BigDecimal(n.toString());
        return n;
    }

    private static boolean isBeanLike(Class<?> type) {
        return !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers())
                && !type.isArray()
                && !type.getName().startsWith("java.");
    }
}

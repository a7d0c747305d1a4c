package com.phylotree.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A self-describing value: a {@link ValueKind} plus its payload.
 *
 * Payload types per kind: BOOLEAN Boolean, BYTE Byte, UNSIGNED_BYTE Integer (0-255),
 * SHORT Short, UNSIGNED_SHORT Integer (0-65535), INT Integer, UNSIGNED_INT Long,
 * LONG Long, UNSIGNED_LONG Long (read as unsigned), FLOAT Float, DOUBLE Double,
 * STRING String (nullable), OBJECT anything (nullable).
 */
public record TypedValue(ValueKind kind, Object payload) {

    public TypedValue {
        Objects.requireNonNull(kind, "kind");
        if (payload == null && kind != ValueKind.STRING && kind != ValueKind.OBJECT) {
            throw new IllegalArgumentException("Missing payload for " + kind.typeName() + " value");
        }
        if (!fits(kind, payload)) {
            throw new IllegalArgumentException("Payload " + payload + " (" + payload.getClass().getSimpleName()
                    + ") does not match " + kind.typeName());
        }
    }

    private static boolean fits(ValueKind kind, Object payload) {
        return switch (kind) {
            case BOOLEAN -> payload instanceof Boolean;
            case BYTE -> payload instanceof Byte;
            case UNSIGNED_BYTE -> payload instanceof Integer i && i >= 0 && i <= 0xFF;
            case SHORT -> payload instanceof Short;
            case UNSIGNED_SHORT -> payload instanceof Integer i && i >= 0 && i <= 0xFFFF;
            case INT -> payload instanceof Integer;
            case UNSIGNED_INT -> payload instanceof Long l && l >= 0 && l <= 0xFFFFFFFFL;
            case LONG, UNSIGNED_LONG -> payload instanceof Long;
            case FLOAT -> payload instanceof Float;
            case DOUBLE -> payload instanceof Double;
            case STRING -> payload == null || payload instanceof String;
            case OBJECT -> true;
        };
    }

    public static TypedValue ofBoolean(boolean value) {
        return new TypedValue(ValueKind.BOOLEAN, value);
    }

    public static TypedValue ofByte(byte value) {
        return new TypedValue(ValueKind.BYTE, value);
    }

    public static TypedValue ofUnsignedByte(int value) {
        return new TypedValue(ValueKind.UNSIGNED_BYTE, value & 0xFF);
    }

    public static TypedValue ofShort(short value) {
        return new TypedValue(ValueKind.SHORT, value);
    }

    public static TypedValue ofUnsignedShort(int value) {
        return new TypedValue(ValueKind.UNSIGNED_SHORT, value & 0xFFFF);
    }

    public static TypedValue ofInt(int value) {
        return new TypedValue(ValueKind.INT, value);
    }

    public static TypedValue ofUnsignedInt(long value) {
        return new TypedValue(ValueKind.UNSIGNED_INT, value & 0xFFFFFFFFL);
    }

    public static TypedValue ofLong(long value) {
        return new TypedValue(ValueKind.LONG, value);
    }

    public static TypedValue ofUnsignedLong(long bits) {
        return new TypedValue(ValueKind.UNSIGNED_LONG, bits);
    }

    public static TypedValue ofFloat(float value) {
        return new TypedValue(ValueKind.FLOAT, value);
    }

    public static TypedValue ofDouble(double value) {
        return new TypedValue(ValueKind.DOUBLE, value);
    }

    public static TypedValue ofString(String value) {
        return new TypedValue(ValueKind.STRING, value);
    }

    public static TypedValue ofObject(Object value) {
        return new TypedValue(ValueKind.OBJECT, value);
    }

    /**
     * Build a value of the given kind from a loosely typed input (a JSON number, boolean or string).
     *
     * @throws IllegalArgumentException if the input cannot be represented as that kind
     */
    public static TypedValue coerce(ValueKind kind, Object raw) {
        try {
            return switch (kind) {
                case BOOLEAN -> ofBoolean(raw instanceof Boolean b ? b : parseBoolean(raw));
                case BYTE -> ofByte((byte) checkRange(toLong(raw), Byte.MIN_VALUE, Byte.MAX_VALUE, kind));
                case UNSIGNED_BYTE -> ofUnsignedByte((int) checkRange(toLong(raw), 0, 0xFFL, kind));
                case SHORT -> ofShort((short) checkRange(toLong(raw), Short.MIN_VALUE, Short.MAX_VALUE, kind));
                case UNSIGNED_SHORT -> ofUnsignedShort((int) checkRange(toLong(raw), 0, 0xFFFFL, kind));
                case INT -> ofInt(Math.toIntExact(toLong(raw)));
                case UNSIGNED_INT -> ofUnsignedInt(checkRange(toLong(raw), 0, 0xFFFFFFFFL, kind));
                case LONG -> ofLong(toLong(raw));
                case UNSIGNED_LONG -> ofUnsignedLong(Long.parseUnsignedLong(String.valueOf(raw)));
                case FLOAT -> ofFloat(toFloat(raw));
                case DOUBLE -> ofDouble(toDouble(raw, kind));
                case STRING -> ofString(raw == null ? null : String.valueOf(raw));
                case OBJECT -> ofObject(raw);
            };
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Value '" + raw + "' is not a valid " + kind.typeName(), e);
        }
    }

    public String typeName() {
        return kind.typeName();
    }

    /**
     * Text form used for element content and attribute values.
     */
    public String asString() {
        return switch (kind) {
            case BOOLEAN, BYTE, UNSIGNED_BYTE, SHORT, UNSIGNED_SHORT, INT, UNSIGNED_INT, LONG ->
                    String.valueOf(payload);
            case UNSIGNED_LONG -> Long.toUnsignedString((Long) payload);
            case FLOAT -> formatFloat((Float) payload);
            case DOUBLE -> formatDouble((Double) payload);
            case STRING, OBJECT -> payload == null ? "" : payload.toString();
        };
    }

    /**
     * Numeric form. Booleans give 1 or 0; strings that do not parse give 0.
     */
    public double asDouble() {
        return switch (kind) {
            case BOOLEAN -> (Boolean) payload ? 1.0 : 0.0;
            case UNSIGNED_LONG -> unsignedToDouble((Long) payload);
            case BYTE, UNSIGNED_BYTE, SHORT, UNSIGNED_SHORT, INT, UNSIGNED_INT, LONG, FLOAT, DOUBLE ->
                    ((Number) payload).doubleValue();
            case STRING, OBJECT -> parseOrZero(payload);
        };
    }

    /**
     * Integral values print without a fractional part ("1" rather than "1.0").
     */
    public static String formatDouble(double value) {
        if (isPrintableAsLong(value)) {
            return String.valueOf((long) value);
        }
        return Double.toString(value);
    }

    static String formatFloat(float value) {
        if (isPrintableAsLong(value)) {
            return String.valueOf((long) value);
        }
        return Float.toString(value);
    }

    private static boolean isPrintableAsLong(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15
                && !(value == 0.0 && 1 / value < 0);
    }

    private static double unsignedToDouble(long bits) {
        if (bits >= 0) {
            return bits;
        }
        return (double) (bits >>> 1) * 2.0 + (bits & 1L);
    }

    private static double parseOrZero(Object payload) {
        if (payload == null) {
            return 0.0;
        }
        if (payload instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(payload.toString().trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static boolean parseBoolean(Object raw) {
        String text = String.valueOf(raw).trim();
        if ("1".equals(text) || "true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("0".equals(text) || "false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new NumberFormatException("Not a boolean: " + text);
    }

    private static long toLong(Object raw) {
        if (raw instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.longValueExact();
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new NumberFormatException("Not an integer: " + raw);
            }
            // longValue() clamps anything outside the long range
            if ((raw instanceof Double || raw instanceof Float) && (d < -0x1p63 || d >= 0x1p63)) {
                throw new NumberFormatException("Out of range for a 64-bit integer: " + raw);
            }
            return n.longValue();
        }
        return Long.parseLong(String.valueOf(raw).trim());
    }

    private static float toFloat(Object raw) {
        double d = toDouble(raw, ValueKind.FLOAT);
        float f = (float) d;
        if (Float.isInfinite(f) && !Double.isInfinite(d)) {
            throw new NumberFormatException("Out of range for " + ValueKind.FLOAT.typeName() + ": " + raw);
        }
        return f;
    }

    private static double toDouble(Object raw, ValueKind kind) {
        double d = raw instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(raw).trim());
        if (Double.isInfinite(d) && !isInfinityLiteral(raw)) {
            throw new NumberFormatException("Out of range for " + kind.typeName() + ": " + raw);
        }
        return d;
    }

    private static boolean isInfinityLiteral(Object raw) {
        if (raw instanceof Double d) {
            return d.isInfinite();
        }
        if (raw instanceof Float f) {
            return f.isInfinite();
        }
        return !(raw instanceof Number) && String.valueOf(raw).contains("Infinity");
    }

    private static long checkRange(long value, long min, long max, ValueKind kind) {
        if (value < min || value > max) {
            throw new NumberFormatException("Out of range for " + kind.typeName() + ": " + value);
        }
        return value;
    }
}

package io.marketlake.marketdata.schema;

import java.util.regex.Pattern;

/**
 * Primitive column types. Each maps to exactly one Java value class; there is no implicit widening.
 */
public enum ColumnType {
    STRING(String.class, "str"),
    INT16(Short.class, "i16"),
    INT32(Integer.class, "i32"),
    INT64(Long.class, "i64"),
    FLOAT64(Double.class, "f64");

    private final Class<?> javaType;
    private final String shortName;

    ColumnType(Class<?> javaType, String shortName) {
        this.javaType = javaType;
        this.shortName = shortName;
    }

    public Class<?> javaType() { return javaType; }
    public String shortName() { return shortName; }

    public boolean accepts(Object value) {
        return value == null || javaType == value.getClass();
    }

    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("-?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?");

    /**
     * Strict cell parse. Empty cells are null. Only plain ASCII literals are accepted: {@code 1.5} is not an INT32,
     * {@code 40000} is not an INT16, and FLOAT64 takes no type suffix, {@code NaN} or infinity.
     *
     * @throws NumberFormatException when the text is not a literal of this type
     */
    public Object parse(String text) {
        if (text == null || text.isEmpty()) return null;
        if (this == STRING) return text;
        String t = text.trim();
        if (this == FLOAT64) {
            if (!DECIMAL.matcher(t).matches()) throw new NumberFormatException("not a decimal: " + text);
            double d = Double.parseDouble(t);
            if (Double.isInfinite(d)) throw new NumberFormatException("out of range: " + text);
            return d;
        }
        if (!INTEGER.matcher(t).matches()) throw new NumberFormatException("not an integer: " + text);
        switch (this) {
            case INT16: return Short.parseShort(t);
            case INT32: return Integer.parseInt(t);
            case INT64: return Long.parseLong(t);
            default: throw new IllegalStateException("unhandled type " + this);
        }
    }

    public String format(Object value) {
        return value == null ? "" : value.toString();
    }
}

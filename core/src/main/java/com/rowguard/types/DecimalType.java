package com.rowguard.types;

/**
 * Fixed precision decimal type.
 *
 * @param precision total number of digits (1 to {@link #MAX_PRECISION})
 * @param scale digits after the decimal point (0 to precision)
 */
public record DecimalType(int precision, int scale) implements DataType {

    public static final int MAX_PRECISION = 38;

    public DecimalType {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                "precision must be between 1 and " + MAX_PRECISION + ": " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException(
                "scale must be between 0 and precision (" + precision + "): " + scale);
        }
    }

    @Override
    public String typeName() {
        return "decimal(" + precision + "," + scale + ")";
    }

    @Override
    public String toString() {
        return typeName();
    }
}

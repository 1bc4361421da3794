package org.carball.profiler.model.value;

import java.math.BigDecimal;
import java.math.BigInteger;

public record NumberValue(Number value) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.NUMBER;
    }

    @Override
    public boolean isFiniteNumber() {
        return Double.isFinite(value.doubleValue());
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    /**
     * Plain decimal text: integral values carry no fractional part, so {@code 1.0} and
     * {@code 1} produce the same key.
     */
    public String toCanonicalString() {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e18) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}

package com.spotladder.domain.order;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exact decimal helpers for prices and amounts at the exchange tick size.
 *
 * <p>Every price or amount goes through {@link #quantize(BigDecimal)} before it is sent to the exchange,
 * stored, or compared, so two values that are mathematically equal are also equal as {@code BigDecimal}s
 * (same scale). Rounding is always toward zero.
 */
public final class Ticks {

    public static final int SCALE = 8;
    public static final BigDecimal TICK_SIZE = BigDecimal.ONE.movePointLeft(SCALE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Ticks() {
    }

    /** Largest multiple of {@link #TICK_SIZE} not exceeding {@code value} (for non-negative input). */
    public static BigDecimal quantize(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    /** {@code reference * (1 - fraction)}, quantized. */
    public static BigDecimal discounted(BigDecimal reference, BigDecimal fraction) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(fraction, "fraction");
        return quantize(reference.multiply(BigDecimal.ONE.subtract(fraction)));
    }

    /** {@code reference * (1 + fraction)}, quantized. */
    public static BigDecimal markedUp(BigDecimal reference, BigDecimal fraction) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(fraction, "fraction");
        return quantize(reference.multiply(BigDecimal.ONE.add(fraction)));
    }

    /** Renders {@code 0.02} as {@code "2"}, {@code 0.025} as {@code "2.5"}. */
    public static String percent(BigDecimal fraction) {
        Objects.requireNonNull(fraction, "fraction");
        BigDecimal p = fraction.multiply(HUNDRED).stripTrailingZeros();
        return p.scale() < 0 ? p.setScale(0).toPlainString() : p.toPlainString();
    }
}

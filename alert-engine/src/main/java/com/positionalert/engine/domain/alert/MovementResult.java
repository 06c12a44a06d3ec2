package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.Direction;
import java.math.BigDecimal;
import java.math.MathContext;

/** Day move of a ticker: {@code (current - previous) / previous * 100}. */
public record MovementResult(String ticker, BigDecimal percentChange, Direction direction) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static MovementResult of(String ticker, BigDecimal current, BigDecimal previous) {
        var percent = percentChange(current, previous);
        return new MovementResult(ticker, percent, directionOf(percent));
    }

    public static BigDecimal percentChange(BigDecimal current, BigDecimal previous) {
        if (previous.signum() <= 0) {
            throw new IllegalArgumentException("Previous price must be positive: " + previous);
        }
        return current.subtract(previous).multiply(HUNDRED).divide(previous, MathContext.DECIMAL64);
    }

    public static Direction directionOf(BigDecimal percent) {
        return switch (percent.signum()) {
            case 1 -> Direction.UP;
            case -1 -> Direction.DOWN;
            default -> Direction.FLAT;
        };
    }
}

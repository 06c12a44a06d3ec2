package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.Direction;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MovementResultTest {

    @Test
    void of_rise_isExactPercentUp() {
        var result = MovementResult.of("AAPL", new BigDecimal("105.00"), new BigDecimal("100.00"));

        assertThat(result.percentChange()).isEqualByComparingTo("5");
        assertThat(result.direction()).isEqualTo(Direction.UP);
    }

    @Test
    void of_fall_isNegativeDown() {
        var result = MovementResult.of("AAPL", new BigDecimal("190.00"), new BigDecimal("200.00"));

        assertThat(result.percentChange()).isEqualByComparingTo("-5");
        assertThat(result.direction()).isEqualTo(Direction.DOWN);
    }

    @Test
    void of_unchanged_isFlat() {
        var result = MovementResult.of("AAPL", new BigDecimal("100"), new BigDecimal("100.00"));

        assertThat(result.percentChange()).isEqualByComparingTo("0");
        assertThat(result.direction()).isEqualTo(Direction.FLAT);
    }

    @Test
    void percentChange_repeatingFraction_keepsSixteenDigits() {
        var percent = MovementResult.percentChange(new BigDecimal("100"), new BigDecimal("3"));

        assertThat(percent.precision()).isEqualTo(16);
        assertThat(percent).isGreaterThan(new BigDecimal("3233.33")).isLessThan(new BigDecimal("3233.34"));
    }

    @Test
    void percentChange_nonPositivePrevious_rejected() {
        assertThatThrownBy(() -> MovementResult.percentChange(BigDecimal.ONE, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

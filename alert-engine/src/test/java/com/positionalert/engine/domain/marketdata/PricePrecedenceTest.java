package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PricePrecedenceTest {

    private final PricePrecedence precedence = PricePrecedence.defaults();

    @Test
    void resolve_primaryPresent_noFallback() {
        var resolved = precedence.resolve(Map.of(
                PriceSource.MINUTE_CLOSE, new BigDecimal("101.5"),
                PriceSource.LAST_TRADE, new BigDecimal("101.7")));

        assertThat(resolved).hasValueSatisfying(price -> {
            assertThat(price.price()).isEqualByComparingTo("101.5");
            assertThat(price.source()).isEqualTo(PriceSource.MINUTE_CLOSE);
            assertThat(price.fallback()).isFalse();
        });
    }

    @Test
    void resolve_primaryZero_fallsBackAndFlagsIt() {
        var resolved = precedence.resolve(Map.of(
                PriceSource.MINUTE_CLOSE, BigDecimal.ZERO,
                PriceSource.LAST_TRADE, new BigDecimal("101.7"),
                PriceSource.DAY_CLOSE, new BigDecimal("100.9")));

        assertThat(resolved).hasValueSatisfying(price -> {
            assertThat(price.source()).isEqualTo(PriceSource.LAST_TRADE);
            assertThat(price.fallback()).isTrue();
        });
    }

    @Test
    void resolve_nothingPositive_empty() {
        assertThat(precedence.resolve(Map.of(PriceSource.DAY_CLOSE, BigDecimal.ZERO))).isEmpty();
    }

    @Test
    void constructor_emptyOrder_rejected() {
        assertThatThrownBy(() -> new PricePrecedence(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}

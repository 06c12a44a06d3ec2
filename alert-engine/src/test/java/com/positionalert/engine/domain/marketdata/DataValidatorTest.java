package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

import static com.positionalert.engine.test.fixtures.MarketFixtures.bars;
import static com.positionalert.engine.test.fixtures.MarketFixtures.rawSnapshotBuilder;
import static org.assertj.core.api.Assertions.assertThat;

class DataValidatorTest {

    private final DataValidator validator = new DataValidator();

    @Test
    void validate_completeEquity_valid() {
        var result = validator.validate(rawSnapshotBuilder("AAPL").minuteBars(bars("100", "101")).build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.reasons()).isEmpty();
        assertThat(result.snapshot().currentPrice()).isEqualByComparingTo("105.00");
        assertThat(result.snapshot().volume()).isEqualTo(1_000_000L);
        assertThat(result.snapshot().minuteBars()).hasSize(2);
    }

    @Test
    void validate_missingFields_collectsEveryReason() {
        var result = validator.validate(rawSnapshotBuilder("AAPL")
                .currentPrice(null)
                .previousClose(BigDecimal.ZERO)
                .volume(null)
                .build());

        assertThat(result.isValid()).isFalse();
        assertThat(result.snapshot()).isNull();
        assertThat(result.reasons()).containsExactlyInAnyOrder(
                RejectionReason.MISSING_CURRENT_PRICE,
                RejectionReason.NON_POSITIVE_PREVIOUS_CLOSE,
                RejectionReason.MISSING_VOLUME);
    }

    @Test
    void validate_negativePriceAndZeroVolume_rejected() {
        var result = validator.validate(rawSnapshotBuilder("AAPL")
                .currentPrice(new BigDecimal("-1"))
                .volume(0L)
                .build());

        assertThat(result.reasons()).containsExactlyInAnyOrder(
                RejectionReason.NON_POSITIVE_CURRENT_PRICE, RejectionReason.NON_POSITIVE_VOLUME);
    }

    @Test
    void validate_indexWithoutVolume_valid() {
        var result = validator.validate(rawSnapshotBuilder("$SPX")
                .kind(InstrumentKind.INDEX)
                .priceSource(PriceSource.INDEX_VALUE)
                .volume(null)
                .averageVolume(null)
                .build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.snapshot().volume()).isZero();
        assertThat(result.snapshot().volumeRatio()).isNull();
    }
}

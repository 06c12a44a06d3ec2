package com.positionalert.engine.domain.position;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TickerSymbolsTest {

    @Test
    void normalize_trimsUppercasesAndConvertsClassSeparator() {
        assertThat(TickerSymbols.normalize(" brk/b ")).isEqualTo("BRK.B");
        assertThat(TickerSymbols.normalize(null)).isEmpty();
    }

    @Test
    void isIndex_dollarPrefix() {
        assertThat(TickerSymbols.isIndex("$SPX")).isTrue();
        assertThat(TickerSymbols.isIndex("SPY")).isFalse();
    }
}

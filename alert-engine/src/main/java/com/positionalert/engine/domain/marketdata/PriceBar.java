package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceBar(Instant timestamp, BigDecimal close, long volume) {}

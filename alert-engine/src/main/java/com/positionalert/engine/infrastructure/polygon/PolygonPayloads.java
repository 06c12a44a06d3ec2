package com.positionalert.engine.infrastructure.polygon;

import com.positionalert.engine.domain.exceptions.FetchException;
import com.positionalert.engine.domain.marketdata.PriceBar;
import com.positionalert.engine.domain.marketdata.PriceSource;
import com.positionalert.engine.domain.marketdata.QuoteFields;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/** Reads Polygon.io response bodies into provider-neutral values. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class PolygonPayloads {

    private static final Set<String> ACCEPTED_STATUSES = Set.of("OK", "DELAYED");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /** Parses the body and checks the envelope {@code status}. */
    static JsonNode parse(ObjectMapper mapper, String ticker, String body) {
        if (body == null || body.isBlank()) {
            throw FetchException.providerError(ticker, "empty response");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JacksonException e) {
            throw FetchException.malformedPayload(ticker, e);
        }
        if (root == null || !root.isObject()) {
            throw FetchException.providerError(ticker, "response is not a JSON object");
        }
        var status = text(root.path("status"));
        if (!ACCEPTED_STATUSES.contains(status)) {
            var error = text(root.path("error"));
            var detail = error.isEmpty() ? "status " + status : error;
            throw FetchException.providerError(ticker, detail);
        }
        return root;
    }

    /** Single-ticker stocks snapshot: {@code min}, {@code lastQuote}, {@code lastTrade}, {@code day}, {@code prevDay}. */
    static QuoteFields tickerSnapshot(String ticker, JsonNode root) {
        var node = root.path("ticker");
        if (!node.isObject()) {
            throw FetchException.providerError(ticker, "no snapshot in response");
        }

        var prices = new EnumMap<PriceSource, BigDecimal>(PriceSource.class);
        decimal(node.path("min").path("c")).ifPresent(p -> prices.put(PriceSource.MINUTE_CLOSE, p));
        decimal(node.path("lastTrade").path("p")).ifPresent(p -> prices.put(PriceSource.LAST_TRADE, p));
        quoteMidpoint(node.path("lastQuote")).ifPresent(p -> prices.put(PriceSource.LAST_QUOTE, p));
        decimal(node.path("day").path("c")).ifPresent(p -> prices.put(PriceSource.DAY_CLOSE, p));

        var minuteVolume = decimal(node.path("min").path("v")).filter(v -> v.signum() > 0);
        var volume = minuteVolume.or(() -> decimal(node.path("day").path("v")))
                .map(BigDecimal::longValue)
                .orElse(null);

        return new QuoteFields(ticker, prices, decimal(node.path("prevDay").path("c")).orElse(null), volume);
    }

    /** Indices snapshot: {@code results[0].value} and {@code results[0].session.previous_close}. */
    static QuoteFields indexSnapshot(String ticker, JsonNode root) {
        var results = root.path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw FetchException.providerError(ticker, "no index data in response");
        }
        var result = results.get(0);
        if (result.has("error")) {
            throw FetchException.providerError(ticker, text(result.path("message")));
        }
        var prices = new EnumMap<PriceSource, BigDecimal>(PriceSource.class);
        decimal(result.path("value")).ifPresent(p -> prices.put(PriceSource.INDEX_VALUE, p));
        return new QuoteFields(
                ticker, prices, decimal(result.path("session").path("previous_close")).orElse(null), null);
    }

    /** Aggregate bars in chronological order, whatever order the provider sent them in. */
    static List<PriceBar> bars(JsonNode root) {
        var results = root.path("results");
        var bars = new ArrayList<PriceBar>(results.size());
        for (int i = 0; i < results.size(); i++) {
            var node = results.get(i);
            var close = decimal(node.path("c"));
            if (close.isEmpty() || !node.path("t").isNumber()) {
                continue;
            }
            bars.add(new PriceBar(
                    Instant.ofEpochMilli(node.path("t").longValue()),
                    close.get(),
                    decimal(node.path("v")).map(BigDecimal::longValue).orElse(0L)));
        }
        bars.sort(Comparator.comparing(PriceBar::timestamp));
        return bars;
    }

    /** Mean of the positive daily volumes, empty when there are none. */
    static Optional<Long> averageVolume(JsonNode root) {
        var total = BigDecimal.ZERO;
        int days = 0;
        var results = root.path("results");
        for (int i = 0; i < results.size(); i++) {
            var volume = decimal(results.get(i).path("v")).filter(v -> v.signum() > 0);
            if (volume.isPresent()) {
                total = total.add(volume.get());
                days++;
            }
        }
        if (days == 0) {
            return Optional.empty();
        }
        return Optional.of(total.divide(BigDecimal.valueOf(days), 0, RoundingMode.HALF_UP).longValue());
    }

    private static Optional<BigDecimal> quoteMidpoint(JsonNode quote) {
        var bid = decimal(quote.path("p")).filter(p -> p.signum() > 0);
        var ask = decimal(quote.path("P")).filter(p -> p.signum() > 0);
        if (bid.isPresent() && ask.isPresent()) {
            return Optional.of(bid.get().add(ask.get()).divide(TWO));
        }
        return bid.or(() -> ask);
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? "" : node.asText();
    }

    private static Optional<BigDecimal> decimal(JsonNode node) {
        return node.isNumber() ? Optional.of(node.decimalValue()) : Optional.empty();
    }
}

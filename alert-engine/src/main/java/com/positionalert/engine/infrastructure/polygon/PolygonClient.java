package com.positionalert.engine.infrastructure.polygon;

import com.positionalert.engine.application.config.AlertProperties;
import com.positionalert.engine.domain.exceptions.FetchException;
import com.positionalert.engine.domain.marketdata.MarketDataProvider;
import com.positionalert.engine.domain.marketdata.PriceBar;
import com.positionalert.engine.domain.marketdata.QuoteFields;
import com.positionalert.engine.domain.marketdata.Sampling;
import com.positionalert.engine.domain.position.TickerSymbols;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Polygon.io REST adapter. Responses are read as text and parsed by {@link PolygonPayloads};
 * HTTP 429 and 403 map to rate-limit and authentication fetch errors.
 */
@Slf4j
@Component
public class PolygonClient implements MarketDataProvider {

    static final String TICKER_SNAPSHOT_PATH = "/v2/snapshot/locale/us/markets/stocks/tickers/{ticker}";
    static final String INDICES_SNAPSHOT_PATH = "/v3/snapshot/indices";
    static final String AGGREGATES_PATH = "/v2/aggs/ticker/{ticker}/range/1/{timespan}/{from}/{to}";

    private static final String INDEX_PREFIX = "I:";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public PolygonClient(RestClient polygonRestClient, ObjectMapper objectMapper, AlertProperties properties) {
        this.restClient = polygonRestClient;
        this.objectMapper = objectMapper;
        this.apiKey = properties.provider().apiKey();
    }

    @Override
    public QuoteFields fetchTickerSnapshot(String ticker) {
        var root = get(ticker, TICKER_SNAPSHOT_PATH, Map.of(), ticker);
        return PolygonPayloads.tickerSnapshot(ticker, root);
    }

    @Override
    public QuoteFields fetchIndexSnapshot(String ticker) {
        var root = get(ticker, INDICES_SNAPSHOT_PATH, Map.of("ticker", toIndexSymbol(ticker)));
        return PolygonPayloads.indexSnapshot(ticker, root);
    }

    @Override
    public Optional<Long> fetchAverageVolume(String ticker, int days, LocalDate asOf) {
        var to = asOf.minusDays(1);
        var from = to.minusDays(days);
        var root = get(ticker, AGGREGATES_PATH,
                Map.of("adjusted", "true", "sort", "asc", "limit", days + 10),
                ticker, "day", from, to);
        var average = PolygonPayloads.averageVolume(root);
        log.debug("{}: {}-day average volume {}", ticker, days, average.orElse(null));
        return average;
    }

    @Override
    public List<PriceBar> fetchBars(String ticker, Sampling sampling, LocalDate date, int limit) {
        var timespan = switch (sampling) {
            case MINUTE -> "minute";
            case SECOND -> "second";
            case DAILY -> "day";
        };
        var root = get(ticker, AGGREGATES_PATH,
                Map.of("adjusted", "true", "sort", "desc", "limit", limit),
                ticker, timespan, date, date);
        return PolygonPayloads.bars(root);
    }

    static String toIndexSymbol(String ticker) {
        return INDEX_PREFIX + ticker.substring(TickerSymbols.INDEX_MARKER.length());
    }

    private JsonNode get(String ticker, String path, Map<String, Object> query, Object... uriVariables) {
        String body;
        try {
            body = restClient.get()
                    .uri(builder -> {
                        builder.path(path);
                        query.forEach((name, value) -> builder.queryParam(name, value));
                        return builder.queryParam("apiKey", apiKey).build(uriVariables);
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw FetchException.forStatus(ticker, response.getStatusCode().value());
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw FetchException.network(ticker, e);
        }
        return PolygonPayloads.parse(objectMapper, ticker, body);
    }
}

package com.positionalert.engine.domain.position;

import com.positionalert.common.event.Direction;
import com.positionalert.common.position.Position;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Positions of one run grouped by normalised ticker, in load order.
 *
 * <p>Keys are never empty. A second row for the same contract (ticker, strike, expiration,
 * type) is dropped. Immutable once built.
 */
@Slf4j
public final class PositionIndex {

    private final Map<String, List<Position>> byTicker;
    private final int positionCount;

    private PositionIndex(Map<String, List<Position>> byTicker) {
        this.byTicker = Collections.unmodifiableMap(byTicker);
        this.positionCount = byTicker.values().stream().mapToInt(List::size).sum();
    }

    public static PositionIndex of(Collection<Position> positions) {
        var byTicker = new LinkedHashMap<String, List<Position>>();
        var seen = new HashSet<Position.ContractKey>();

        for (var position : positions) {
            var ticker = TickerSymbols.normalize(position.ticker());
            if (ticker.isEmpty() || position.optionType() == null) {
                log.warn("Skipping position without ticker or option type: {}", position);
                continue;
            }
            var normalized = position.toBuilder().ticker(ticker).build();
            if (!seen.add(normalized.contractKey())) {
                log.debug("Dropping duplicate position {}", normalized.contractKey());
                continue;
            }
            byTicker.computeIfAbsent(ticker, k -> new ArrayList<>()).add(normalized);
        }

        byTicker.replaceAll((ticker, list) -> List.copyOf(list));
        return new PositionIndex(byTicker);
    }

    public Set<String> tickers() {
        return byTicker.keySet();
    }

    public List<Position> positions(String ticker) {
        return byTicker.getOrDefault(ticker, List.of());
    }

    /** UP when the ticker has a call, DOWN when it has a put; both when it has both. */
    public Set<Direction> watchedDirections(String ticker) {
        var directions = EnumSet.noneOf(Direction.class);
        for (var position : positions(ticker)) {
            directions.add(position.optionType().watchedDirection());
        }
        return directions;
    }

    public List<Position> matching(String ticker, Direction direction) {
        return positions(ticker).stream()
                .filter(p -> p.optionType().watchedDirection() == direction)
                .toList();
    }

    public int positionCount() {
        return positionCount;
    }

    public boolean isEmpty() {
        return byTicker.isEmpty();
    }
}

package com.positionalert.engine.infrastructure.positions;

import com.positionalert.common.position.OptionType;
import com.positionalert.common.position.Position;
import com.positionalert.engine.application.config.AlertProperties;
import com.positionalert.engine.domain.exceptions.PositionsParseException;
import com.positionalert.engine.domain.position.PositionSource;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads the broker positions export already downloaded to local disk. Each element of the
 * top-level array is one option leg, keyed by the broker's column names.
 */
@Slf4j
@Component
public class JsonPositionsFileSource implements PositionSource {

    static final String UNDERLYING = "Underlying";
    static final String PUT_CALL = "Put/Call";
    static final String STRIKE = "Strike";
    static final String EXPIRATION = "Exp";
    static final String QUANTITY = "Qty";
    static final String OPTION_SYMBOL = "Option Symbol";
    static final String AVERAGE_PRICE = "Avg Price";

    private final ObjectMapper objectMapper;
    private final Path file;

    public JsonPositionsFileSource(ObjectMapper objectMapper, AlertProperties properties) {
        this.objectMapper = objectMapper;
        this.file = Path.of(properties.positions().file());
    }

    @Override
    public List<Position> load() {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file));
        } catch (IOException | JacksonException e) {
            throw PositionsParseException.unreadable(file.toString(), e);
        }
        if (root == null || !root.isArray()) {
            throw PositionsParseException.notAnArray(file.toString());
        }

        var positions = new ArrayList<Position>(root.size());
        for (int i = 0; i < root.size(); i++) {
            toPosition(root.get(i), i).ifPresent(positions::add);
        }
        if (positions.isEmpty()) {
            throw PositionsParseException.noValidPositions(file.toString());
        }
        log.info("Loaded {} positions from {} ({} rows)", positions.size(), file, root.size());
        return positions;
    }

    private Optional<Position> toPosition(JsonNode row, int rowNumber) {
        var underlying = text(row, UNDERLYING);
        if (underlying.isEmpty()) {
            log.warn("Positions row {} has no {}, skipping", rowNumber, UNDERLYING);
            return Optional.empty();
        }
        var optionType = OptionType.fromLabel(text(row, PUT_CALL));
        if (optionType.isEmpty()) {
            log.debug("Positions row {} ({}) is not a call or put, skipping", rowNumber, underlying);
            return Optional.empty();
        }
        try {
            return Optional.of(Position.builder()
                    .ticker(underlying)
                    .optionType(optionType.get())
                    .strike(decimal(row, STRIKE))
                    .expiration(date(row))
                    .quantity(quantity(row))
                    .optionSymbol(text(row, OPTION_SYMBOL))
                    .averagePrice(decimal(row, AVERAGE_PRICE))
                    .build());
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Positions row {} ({}) is malformed, skipping: {}", rowNumber, underlying, e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode row, String field) {
        var node = row.path(field);
        return node.isMissingNode() || node.isNull() ? "" : node.asText().trim();
    }

    private static BigDecimal decimal(JsonNode row, String field) {
        var node = row.path(field);
        if (node.isNumber()) {
            return node.decimalValue();
        }
        var text = text(row, field).replace("$", "").replace(",", "");
        return text.isEmpty() ? null : new BigDecimal(text);
    }

    private static int quantity(JsonNode row) {
        var node = row.path(QUANTITY);
        if (node.isNumber()) {
            return node.decimalValue().intValue();
        }
        var text = text(row, QUANTITY).replace(",", "");
        return text.isEmpty() ? 0 : new BigDecimal(text).intValue();
    }

    private static LocalDate date(JsonNode row) {
        var text = text(row, EXPIRATION);
        return text.isEmpty() ? null : LocalDate.parse(text);
    }
}

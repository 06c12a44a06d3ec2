package com.positionalert.common.position;

import com.positionalert.common.event.Direction;
import java.util.Locale;
import java.util.Optional;

public enum OptionType {
    CALL(Direction.UP),
    PUT(Direction.DOWN);

    private final Direction watchedDirection;

    OptionType(Direction watchedDirection) {
        this.watchedDirection = watchedDirection;
    }

    /** The price direction that moves this option into the money. */
    public Direction watchedDirection() {
        return watchedDirection;
    }

    /**
     * Parses broker labels such as {@code "Call"}, {@code "PUT"} or {@code "C"}.
     *
     * @return empty for blank or unrecognised labels
     */
    public static Optional<OptionType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "CALL", "C" -> Optional.of(CALL);
            case "PUT", "P" -> Optional.of(PUT);
            default -> Optional.empty();
        };
    }
}

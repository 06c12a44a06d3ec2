package com.positionalert.engine.domain.exceptions;

public class PositionsParseException extends RuntimeException {

    private PositionsParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PositionsParseException unreadable(String source, Throwable cause) {
        return new PositionsParseException("Cannot read positions from " + source, cause);
    }

    public static PositionsParseException notAnArray(String source) {
        return new PositionsParseException("Positions document in " + source + " is not a JSON array", null);
    }

    public static PositionsParseException noValidPositions(String source) {
        return new PositionsParseException("No valid positions found in " + source, null);
    }
}

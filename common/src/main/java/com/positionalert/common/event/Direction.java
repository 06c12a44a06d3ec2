package com.positionalert.common.event;

/** Direction of a price move relative to the previous close. */
public enum Direction {
    UP,
    DOWN,
    FLAT
}

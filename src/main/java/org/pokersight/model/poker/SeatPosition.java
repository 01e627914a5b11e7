package org.pokersight.model.poker;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Seats in table order, hero first. */
public enum SeatPosition {
    HERO("Hero"),
    POSITION_1("Position_1"),
    POSITION_2("Position_2"),
    POSITION_3("Position_3"),
    POSITION_4("Position_4"),
    POSITION_5("Position_5"),
    POSITION_6("Position_6"),
    POSITION_7("Position_7"),
    POSITION_8("Position_8");

    private final String key;

    SeatPosition(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }

    public static Optional<SeatPosition> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (SeatPosition p : values()) {
            if (p.key.equalsIgnoreCase(key.strip()) || p.name().equalsIgnoreCase(key.strip())) return Optional.of(p);
        }
        return Optional.empty();
    }
}

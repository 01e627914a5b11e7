package org.pokersight.model.poker;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class SeatRecord {
    public static final String EMPTY = "Empty";
    public static final String UNKNOWN = "Unknown";

    private SeatPosition position;
    private String name = EMPTY;
    private Long chips;          // null = never read, not zero
    private Double bbSize;
    private Instant lastUpdated;
    private double confidence = 0.0;

    public SeatRecord(SeatPosition position, Instant at) {
        this.position = position;
        this.lastUpdated = at;
    }

    public static SeatRecord empty(SeatPosition position, Instant at) {
        return new SeatRecord(position, at);
    }

    public boolean isActive() {
        return !EMPTY.equals(name) && chips != null && chips > 0;
    }
}

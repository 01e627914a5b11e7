package org.pokersight.model.poker;

import lombok.Data;

import java.time.Instant;
import java.util.*;

/**
 * Seat table of one observed tournament. Seats are never removed: an eliminated player's seat
 * goes back to "Empty".
 */
@Data
public class TournamentState {
    private final Map<SeatPosition, SeatRecord> seats = new EnumMap<>(SeatPosition.class);
    private final List<EliminationEvent> eliminations = new ArrayList<>();

    private long totalChips = 0;
    private Long smallBlind;
    private Long bigBlind;
    private Instant startedAt;
    private Instant lastUpdate;

    public TournamentState(Instant startedAt) {
        this.startedAt = startedAt;
        for (SeatPosition p : SeatPosition.values()) seats.put(p, SeatRecord.empty(p, startedAt));
    }

    public TournamentState() { this(Instant.now()); }

    public SeatRecord seat(SeatPosition p) { return seats.get(p); }

    public List<SeatRecord> activeSeats() {
        return seats.values().stream().filter(SeatRecord::isActive).toList();
    }
}

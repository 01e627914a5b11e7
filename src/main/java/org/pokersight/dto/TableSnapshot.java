package org.pokersight.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the recognizer read off the table in one frame. Any text may be blank or wrong.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableSnapshot {
    @Size(max = 2)
    private List<String> heroCards = new ArrayList<>();

    /** Board order */
    @Size(max = 5)
    private List<String> communityCards = new ArrayList<>();

    @Size(max = 64)
    private String pot;

    /** Seat key ("Hero", "Position_1".."Position_8") -> raw reading */
    @Size(max = 9)
    private Map<String, @Valid SeatReading> tournamentSeats = new LinkedHashMap<>();

    /** Overrides the stage heuristic when the caller knows better */
    @PositiveOrZero
    @JsonAlias("activeOpponentCardCount")
    private Integer activeOpponentCount;

    /** e.g. "25/50", "1K/2K" */
    @Size(max = 32)
    private String blinds;
}

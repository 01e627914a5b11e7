package org.pokersight.dto;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TournamentSummaryDto {
    private String sessionId;
    private long passCount;
    private int handCount;
    private String currentStage;
    private TournamentMetricsDto metrics;
    /** Oldest first */
    private List<EliminationDto> eliminations;
    private Instant lastUpdate;
}

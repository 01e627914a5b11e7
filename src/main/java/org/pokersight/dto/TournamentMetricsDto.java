package org.pokersight.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TournamentMetricsDto {
    private int activePlayers;
    private long totalChips;
    private double averageStack;
    private SeatSummaryDto chipLeader;
    private SeatSummaryDto shortStack;
    /** Null when the hero has no chips on record */
    private Integer heroRank;
    private double heroChipShare;
    private Double heroStackBb;
    private Long smallBlind;
    private Long bigBlind;
    private List<SeatSummaryDto> standings;
}

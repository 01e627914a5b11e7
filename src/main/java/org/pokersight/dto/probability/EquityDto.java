package org.pokersight.dto.probability;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EquityDto {
    private double winPercentage;
    private double tiePercentage;
    private double losePercentage;
    /** False when the numbers are the opponent-count estimate rather than sampled showdowns */
    private boolean simulated;
    private int totalSimulations;
    /** Sampled win rate against a single opponent, null when not simulated */
    private Double singleOpponentWinRate;
    private int opponents;
}

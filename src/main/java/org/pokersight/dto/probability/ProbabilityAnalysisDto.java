package org.pokersight.dto.probability;

import lombok.*;
import org.pokersight.model.poker.rules.BoardRules;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProbabilityAnalysisDto {
    private int opponents;
    private int activePlayers;
    private int remainingDeckSize;
    private EquityDto equity;
    private BoardRules.Texture boardTexture;
    private BoardRules.Outs outs;
    /** Only once the flop is out */
    private OpponentProfileDto opponentProfile;
}

package org.pokersight.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeckAnalysisDto {
    private int knownCount;
    private int unknownCount;
    private List<String> knownCards;
    private int seatedPlayers;
    private int sittingOutPlayers;
    private int activeSeatedPlayers;
    /** Over the whole session */
    private int eliminatedPlayers;
    private int remainingDeckSize;
    private int estimatedActivePlayers;
}

package org.pokersight.dto;

import lombok.*;
import org.pokersight.model.poker.EliminationEvent;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EliminationDto {
    private String position;
    private String playerName;
    private long lastStack;
    private Instant eliminatedAt;
    private int finishingPlace;

    public static EliminationDto of(EliminationEvent e) {
        return EliminationDto.builder()
                .position(e.position().key())
                .playerName(e.playerName())
                .lastStack(e.lastStack())
                .eliminatedAt(e.at())
                .finishingPlace(e.finishingPlace())
                .build();
    }
}

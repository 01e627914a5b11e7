package org.pokersight.dto;

import lombok.*;
import org.pokersight.model.poker.Card;
import org.pokersight.model.poker.HandEvaluation;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HandEvaluationDto {
    private String category;
    private int categoryIndex;
    private String description;
    private int score;
    private List<Integer> tieBreak;
    private List<String> cards;
    /** Pre-flop scores live on their own scale */
    private boolean preflop;

    public static HandEvaluationDto of(HandEvaluation e) {
        return HandEvaluationDto.builder()
                .category(e.category().label())
                .categoryIndex(e.category().index())
                .description(e.description())
                .score(e.score())
                .tieBreak(e.tieBreak())
                .cards(e.cards().stream().map(Card::toText).toList())
                .preflop(e.preflop())
                .build();
    }
}

package org.pokersight.model.poker;

import java.util.List;

/**
 * Immutable evaluation of a hand. {@code score} compares with plain {@code >} across any two
 * post-flop evaluations; pre-flop evaluations use their own scale and are flagged.
 *
 * @param tieBreak category index followed by the significant ranks, most significant first
 * @param cards    the winning cards (5 post-flop, the 2 hole cards pre-flop)
 */
public record HandEvaluation(HandCategory category,
                             int score,
                             List<Integer> tieBreak,
                             String description,
                             List<Card> cards,
                             boolean preflop) {

    public HandEvaluation {
        tieBreak = List.copyOf(tieBreak);
        cards = List.copyOf(cards);
    }

    public boolean beats(HandEvaluation other) { return score > other.score; }
}

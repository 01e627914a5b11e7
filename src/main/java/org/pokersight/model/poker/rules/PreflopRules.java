package org.pokersight.model.poker.rules;

import org.pokersight.model.poker.Card;
import org.pokersight.model.poker.HandCategory;
import org.pokersight.model.poker.HandEvaluation;
import org.pokersight.model.poker.exception.DuplicateCardException;

import java.util.List;

/**
 * Two-card classification used before the flop only. Scores here are on their own scale and
 * never compared with {@link HandRules} scores.
 */
public final class PreflopRules {
    private PreflopRules(){}

    public static HandEvaluation evaluate(List<Card> hole) {
        if (hole.size() != 2) throw new IllegalArgumentException("Pre-flop evaluation needs exactly 2 cards, got " + hole.size());
        Card c1 = hole.get(0), c2 = hole.get(1);
        if (c1.equals(c2)) throw new DuplicateCardException(c1);

        if (c1.getRank() == c2.getRank()) {
            int r = c1.getRank().value();
            return new HandEvaluation(HandCategory.ONE_PAIR, 2000 + r * 100, List.of(HandCategory.ONE_PAIR.index(), r),
                    "Pocket " + c1.getRank().plural(), hole, true);
        }

        Card high = c1.getRank().value() > c2.getRank().value() ? c1 : c2;
        Card low = high == c1 ? c2 : c1;
        boolean suited = c1.getSuit() == c2.getSuit();
        int score = 1000 + high.getRank().value() * 15 + low.getRank().value() + (suited ? 50 : 0);
        String description = high.getRank().symbol() + low.getRank().symbol() + (suited ? " suited" : " offsuit");
        return new HandEvaluation(HandCategory.HIGH_CARD, score,
                List.of(HandCategory.HIGH_CARD.index(), high.getRank().value(), low.getRank().value()),
                description, List.of(high, low), true);
    }
}

package org.pokersight.model.poker.rules;

import org.pokersight.model.poker.Card;
import org.pokersight.model.poker.HandCategory;
import org.pokersight.model.poker.HandEvaluation;
import org.pokersight.model.poker.exception.DuplicateCardException;
import org.pokersight.model.poker.exception.InsufficientCardsException;

import java.util.*;

/**
 * Best-five-of-seven evaluation.
 * Score = category index * 15^5 + the significant ranks written in base 15, so one score
 * compares correctly against any other, whatever the category.
 */
public final class HandRules {
    private HandRules(){}

    static final int CATEGORY_BASE = 15 * 15 * 15 * 15 * 15;

    public static HandEvaluation evaluate(List<Card> cards) {
        if (cards.size() < 5) throw new InsufficientCardsException(cards.size(), 5);
        if (cards.size() > 7) throw new IllegalArgumentException("At most 7 cards can be evaluated, got " + cards.size());
        Set<Card> seen = new HashSet<>();
        for (Card c : cards) {
            if (!seen.add(c)) throw new DuplicateCardException(c);
        }
        if (cards.size() == 5) return evaluateFive(cards);

        HandEvaluation best = null;
        int n = cards.size();
        for (int a = 0; a < n; a++)
            for (int b = a + 1; b < n; b++)
                for (int c = b + 1; c < n; c++)
                    for (int d = c + 1; d < n; d++)
                        for (int e = d + 1; e < n; e++) {
                            HandEvaluation ev = evaluateFive(List.of(
                                    cards.get(a), cards.get(b), cards.get(c), cards.get(d), cards.get(e)));
                            if (best == null || ev.beats(best)) best = ev;
                        }
        return best;
    }

    static HandEvaluation evaluateFive(List<Card> five) {
        // groups ordered by size then rank: (A,A,A,K,K) -> [A x3, K x2]
        Map<Card.Rank, List<Card>> byRank = new EnumMap<>(Card.Rank.class);
        for (Card c : five) byRank.computeIfAbsent(c.getRank(), r -> new ArrayList<>()).add(c);
        List<List<Card>> groups = new ArrayList<>(byRank.values());
        groups.sort((x, y) -> x.size() != y.size()
                ? y.size() - x.size()
                : y.get(0).getRank().value() - x.get(0).getRank().value());

        List<Card> ordered = new ArrayList<>(5);
        List<Integer> ranks = new ArrayList<>(5);
        for (List<Card> g : groups) {
            ordered.addAll(g);
            ranks.add(g.get(0).getRank().value());
        }

        boolean flush = five.stream().map(Card::getSuit).distinct().count() == 1;
        int straightHigh = straightHigh(ranks);
        if (straightHigh == 5) {
            // wheel: the ace plays low
            ordered.add(ordered.remove(0));
        }

        if (straightHigh > 0 && flush) {
            if (straightHigh == 14) return build(HandCategory.ROYAL_FLUSH, List.of(14), "Royal Flush", ordered);
            return build(HandCategory.STRAIGHT_FLUSH, List.of(straightHigh),
                    "Straight Flush, " + label(straightHigh) + " high", ordered);
        }
        int top = groups.get(0).size();
        int second = groups.size() > 1 ? groups.get(1).size() : 0;
        if (top == 4) {
            return build(HandCategory.FOUR_OF_A_KIND, ranks, "Four of a Kind, " + plural(ranks.get(0)), ordered);
        }
        if (top == 3 && second == 2) {
            return build(HandCategory.FULL_HOUSE, ranks,
                    "Full House, " + plural(ranks.get(0)) + " over " + plural(ranks.get(1)), ordered);
        }
        if (flush) {
            return build(HandCategory.FLUSH, ranks, "Flush, " + label(ranks.get(0)) + " high", ordered);
        }
        if (straightHigh > 0) {
            return build(HandCategory.STRAIGHT, List.of(straightHigh), "Straight, " + label(straightHigh) + " high", ordered);
        }
        if (top == 3) {
            return build(HandCategory.THREE_OF_A_KIND, ranks, "Three of a Kind, " + plural(ranks.get(0)), ordered);
        }
        if (top == 2 && second == 2) {
            return build(HandCategory.TWO_PAIR, ranks,
                    "Two Pair, " + plural(ranks.get(0)) + " and " + plural(ranks.get(1)), ordered);
        }
        if (top == 2) {
            return build(HandCategory.ONE_PAIR, ranks, "Pair of " + plural(ranks.get(0)), ordered);
        }
        return build(HandCategory.HIGH_CARD, ranks, label(ranks.get(0)) + " high", ordered);
    }

    /**
     * High card of the straight formed by five distinct ranks (given descending), 5 for the
     * wheel, 0 when there is none.
     */
    static int straightHigh(List<Integer> distinctDesc) {
        if (distinctDesc.size() != 5) return 0;
        if (distinctDesc.get(0) - distinctDesc.get(4) == 4) return distinctDesc.get(0);
        if (distinctDesc.equals(List.of(14, 5, 4, 3, 2))) return 5;
        return 0;
    }

    public static int score(HandCategory category, List<Integer> significantRanks) {
        int value = 0;
        for (int i = 0; i < 5; i++) {
            value = value * 15 + (i < significantRanks.size() ? significantRanks.get(i) : 0);
        }
        return category.index() * CATEGORY_BASE + value;
    }

    private static HandEvaluation build(HandCategory cat, List<Integer> ranks, String description, List<Card> cards) {
        List<Integer> tieBreak = new ArrayList<>(ranks.size() + 1);
        tieBreak.add(cat.index());
        tieBreak.addAll(ranks);
        return new HandEvaluation(cat, score(cat, ranks), tieBreak, description, cards, false);
    }

    private static String label(int value) { return Card.Rank.ofValue(value).label(); }
    private static String plural(int value) { return Card.Rank.ofValue(value).plural(); }
}

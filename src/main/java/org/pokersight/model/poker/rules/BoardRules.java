package org.pokersight.model.poker.rules;

import org.pokersight.model.poker.Card;

import java.util.*;

/**
 * Board texture and drawing outs.
 */
public final class BoardRules {
    private BoardRules(){}

    public record Texture(boolean flushDrawPossible,
                          boolean straightDrawPossible,
                          boolean pairedBoard,
                          String wetness,
                          String dangerLevel,
                          double dangerScore,
                          double playerMultiplier,
                          List<String> warnings) {}

    public record Outs(int totalOuts, List<String> outCards, int cardsToCome, double improvePercent) {}

    public static Texture texture(List<Card> board, int opponents) {
        double multiplier = playerMultiplier(opponents);
        if (board.size() < 3) return new Texture(false, false, false, "Dry", "Low", 0.0, multiplier, List.of());

        Map<Card.Suit, Integer> suits = new EnumMap<>(Card.Suit.class);
        Map<Card.Rank, Integer> ranks = new EnumMap<>(Card.Rank.class);
        for (Card c : board) {
            suits.merge(c.getSuit(), 1, Integer::sum);
            ranks.merge(c.getRank(), 1, Integer::sum);
        }
        boolean flush = suits.values().stream().anyMatch(n -> n >= 3);
        boolean straight = hasFourRankWindow(ranks.keySet());
        boolean paired = ranks.values().stream().anyMatch(n -> n >= 2);

        int flags = (flush ? 1 : 0) + (straight ? 1 : 0) + (paired ? 1 : 0);
        double danger = flags * multiplier;
        String wetness, level;
        if (danger >= 3.0)      { wetness = "Very Wet";       level = "Very High"; }
        else if (danger >= 2.0) { wetness = "Wet";            level = "High"; }
        else if (danger >= 1.0) { wetness = "Moderately Wet"; level = "Medium"; }
        else                    { wetness = "Dry";            level = "Low"; }

        List<String> warnings = new ArrayList<>();
        if (flush && opponents >= 4) warnings.add("High flush completion risk with many opponents");
        if (straight && opponents >= 5) warnings.add("Multiple straight possibilities with many players");
        if (paired && opponents >= 3) warnings.add("Full house/trips risk in multi-way pot");

        return new Texture(flush, straight, paired, wetness, level, danger, multiplier, List.copyOf(warnings));
    }

    static double playerMultiplier(int opponents) {
        if (opponents >= 7) return 2.0;
        if (opponents >= 4) return 1.5;
        if (opponents >= 2) return 1.2;
        return 1.0;
    }

    /** Four distinct ranks spanning exactly four consecutive values, or A-2-3-4. */
    static boolean hasFourRankWindow(Set<Card.Rank> present) {
        List<Integer> values = present.stream().map(Card.Rank::value).sorted().toList();
        for (int i = 0; i + 3 < values.size(); i++) {
            if (values.get(i + 3) - values.get(i) == 3) return true;
        }
        return values.containsAll(List.of(2, 3, 4, 14));
    }

    /**
     * Outs over hero + board. Unknown cards completing a four-card suit, plus unknown cards of
     * each missing rank that extends a run of four consecutive ranks (Ace may play low).
     */
    public static Outs outs(List<Card> hole, List<Card> board) {
        List<Card> all = new ArrayList<>(hole);
        all.addAll(board);
        Set<Card> known = new HashSet<>(all);

        Map<Card.Suit, Integer> suits = new EnumMap<>(Card.Suit.class);
        boolean[] present = new boolean[15]; // index 1 = ace low, 14 = ace high
        for (Card c : all) {
            suits.merge(c.getSuit(), 1, Integer::sum);
            present[c.getRank().value()] = true;
        }
        present[1] = present[14];

        Set<Card> outs = new LinkedHashSet<>();
        for (Map.Entry<Card.Suit, Integer> e : suits.entrySet()) {
            if (e.getValue() != 4) continue;
            for (Card c : Card.fullDeck()) {
                if (c.getSuit() == e.getKey() && !known.contains(c)) outs.add(c);
            }
        }

        Set<Integer> extending = new TreeSet<>();
        for (int low = 1; low + 3 <= 14; low++) {
            if (present[low] && present[low + 1] && present[low + 2] && present[low + 3]) {
                if (low - 1 >= 1 && !present[low - 1]) extending.add(low - 1);
                if (low + 4 <= 14 && !present[low + 4]) extending.add(low + 4);
            }
        }
        for (int v : extending) {
            int rankValue = v == 1 ? 14 : v;
            for (Card c : Card.fullDeck()) {
                if (c.getRank().value() == rankValue && !known.contains(c)) outs.add(c);
            }
        }

        int toCome = Math.max(0, 5 - board.size());
        int perOut = toCome >= 2 ? 4 : toCome == 1 ? 2 : 0;
        double improve = Math.min(100.0, outs.size() * perOut);
        List<String> texts = outs.stream().map(Card::toText).toList();
        return new Outs(outs.size(), texts, toCome, improve);
    }
}

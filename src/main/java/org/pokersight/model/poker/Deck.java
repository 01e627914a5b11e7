package org.pokersight.model.poker;

import java.util.*;

/**
 * Known/unknown partition of the 52 cards as seen by one observer during one pass.
 */
public class Deck {
    private final Set<Card> known = new LinkedHashSet<>();
    private final Set<Card> unknown = new LinkedHashSet<>();

    public Deck() { reset(); }

    public void reset() {
        known.clear();
        unknown.clear();
        unknown.addAll(Card.fullDeck());
    }

    public void markKnown(Card card) {
        if (unknown.remove(card)) known.add(card);
    }

    public void markKnown(Collection<Card> cards) {
        for (Card c : cards) markKnown(c);
    }

    public boolean isKnown(Card card) { return known.contains(card); }

    public int knownCount() { return known.size(); }
    public int unknownCount() { return unknown.size(); }

    public Set<Card> knownCards() { return Collections.unmodifiableSet(known); }

    /** Unknown cards in full-deck order (stable, so seeded sampling is reproducible). */
    public List<Card> unknownCards() {
        List<Card> out = new ArrayList<>(unknown.size());
        for (Card c : Card.fullDeck()) if (unknown.contains(c)) out.add(c);
        return out;
    }
}

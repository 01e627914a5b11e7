package org.pokersight.model.poker;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeckTest {

    @Test
    void newDeck_allUnknown() {
        Deck deck = new Deck();
        assertThat(deck.knownCount()).isZero();
        assertThat(deck.unknownCount()).isEqualTo(52);
        assertThat(deck.unknownCards()).containsExactlyElementsOf(Card.fullDeck());
    }

    @Test
    void markKnown_keepsPartitionOf52_evenWithRepeats() {
        Deck deck = new Deck();
        deck.markKnown(List.of(Card.parse("A♠"), Card.parse("K♠"), Card.parse("A♠")));
        deck.markKnown(Card.parse("2♦"));

        assertThat(deck.knownCount()).isEqualTo(3);
        assertThat(deck.knownCount() + deck.unknownCount()).isEqualTo(52);
        Set<Card> overlap = new HashSet<>(deck.knownCards());
        overlap.retainAll(deck.unknownCards());
        assertThat(overlap).isEmpty();
        assertThat(deck.isKnown(Card.parse("K♠"))).isTrue();
    }

    @Test
    void reset_forgetsKnownCards() {
        Deck deck = new Deck();
        deck.markKnown(Card.parse("A♠"));
        deck.reset();
        assertThat(deck.knownCount()).isZero();
        assertThat(deck.unknownCount()).isEqualTo(52);
    }
}

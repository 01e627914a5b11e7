package org.pokersight.model.poker;

import java.util.List;

public record StageInfo(Stage stage, int cardCount, List<Card> cards, int expectedCount, double confidence) {
    public StageInfo {
        cards = List.copyOf(cards);
    }
}

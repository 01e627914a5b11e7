package org.pokersight.model.poker.exception;

import lombok.Getter;
import org.pokersight.model.poker.Card;

@Getter
public class DuplicateCardException extends IllegalArgumentException {
    private final Card card;

    public DuplicateCardException(Card card) {
        super("Card " + card.toText() + " appears more than once");
        this.card = card;
    }
}

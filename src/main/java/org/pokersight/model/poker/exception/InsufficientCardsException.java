package org.pokersight.model.poker.exception;

import lombok.Getter;

@Getter
public class InsufficientCardsException extends IllegalArgumentException {
    private final int provided;

    public InsufficientCardsException(int provided, int required) {
        super("Need at least " + required + " cards, got " + provided);
        this.provided = provided;
    }
}

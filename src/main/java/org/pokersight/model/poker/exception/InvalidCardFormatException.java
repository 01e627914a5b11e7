package org.pokersight.model.poker.exception;

import lombok.Getter;

/** Card text whose rank or suit token is not recognized. */
@Getter
public class InvalidCardFormatException extends IllegalArgumentException {
    private final String text;

    public InvalidCardFormatException(String text, String reason) {
        super("Invalid card '" + text + "': " + reason);
        this.text = text;
    }
}

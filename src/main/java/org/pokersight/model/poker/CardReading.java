package org.pokersight.model.poker;

import org.pokersight.model.poker.exception.InvalidCardFormatException;

import java.util.Locale;
import java.util.Set;

/**
 * Outcome of reading one card slot produced by the recognizer.
 * A blank slot means the recognizer saw nothing it could read, which is not the same as
 * an explicit "no card" marker.
 */
public record CardReading(Status status, String raw, Card card, String error) {

    public enum Status { NOT_RECOGNIZED, ABSENT, PARSED, PARSE_ERROR }

    private static final Set<String> ABSENT_MARKERS = Set.of("UNKNOWN", "EMPTY", "NONE", "-");

    public static CardReading of(String raw) {
        if (raw == null || raw.isBlank()) return new CardReading(Status.NOT_RECOGNIZED, raw, null, null);
        if (ABSENT_MARKERS.contains(raw.strip().toUpperCase(Locale.ROOT))) {
            return new CardReading(Status.ABSENT, raw, null, null);
        }
        try {
            return new CardReading(Status.PARSED, raw, Card.parse(raw), null);
        } catch (InvalidCardFormatException ex) {
            return new CardReading(Status.PARSE_ERROR, raw, null, ex.getMessage());
        }
    }
}

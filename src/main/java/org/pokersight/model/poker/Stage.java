package org.pokersight.model.poker;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Stage {
    PRE_FLOP("Pre-Flop", 0, 0),
    FLOP("Flop", 3, 1),
    TURN("Turn", 4, 2),
    RIVER("River", 5, 3),
    UNKNOWN("Unknown", 0, -1);

    private final String label;
    private final int expectedCards;
    private final int order;

    Stage(String label, int expectedCards, int order) {
        this.label = label;
        this.expectedCards = expectedCards;
        this.order = order;
    }

    @JsonValue
    public String label() { return label; }
    public int expectedCards() { return expectedCards; }
    /** Pre-Flop 0 .. River 3; Unknown has no place in the order (-1). */
    public int order() { return order; }

    public static Stage ofCommunityCount(int count) {
        return switch (count) {
            case 0 -> PRE_FLOP;
            case 3 -> FLOP;
            case 4 -> TURN;
            case 5 -> RIVER;
            default -> UNKNOWN;
        };
    }
}

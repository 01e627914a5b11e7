package org.pokersight.model.poker;

public enum HandCategory {
    HIGH_CARD("High Card"),
    ONE_PAIR("One Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush"),
    ROYAL_FLUSH("Royal Flush");

    private final String label;

    HandCategory(String label) { this.label = label; }

    public String label() { return label; }

    /** 1 for High Card .. 10 for Royal Flush. */
    public int index() { return ordinal() + 1; }
}

package org.pokersight.model.poker;

public record HandTransition(Kind kind, Stage from, Stage to, boolean handCounted, String finishReason) {

    public enum Kind {
        /** Stage unchanged since the previous pass. */
        NONE,
        HAND_FINISHED,
        NEW_HAND,
        PROGRESSION,
        /** Moved back within a hand, e.g. River to Flop; recognition noise. */
        BACKWARD,
        UNCLASSIFIED
    }

    public static HandTransition none(Stage stage) {
        return new HandTransition(Kind.NONE, stage, stage, false, null);
    }
}

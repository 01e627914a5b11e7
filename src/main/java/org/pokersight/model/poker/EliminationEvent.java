package org.pokersight.model.poker;

import java.time.Instant;

/**
 * @param finishingPlace place the player finished in, derived from the players still active
 *                       right after the elimination (last active + 1)
 */
public record EliminationEvent(SeatPosition position, String playerName, long lastStack, Instant at, int finishingPlace) {}

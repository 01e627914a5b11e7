package org.pokersight.model.poker;

import lombok.Data;

/**
 * Stage-machine state carried from one pass to the next within a session.
 */
@Data
public class HandProgress {
    public static final String NO_FINISH_YET = "Unknown";

    private Stage currentStage = Stage.UNKNOWN;
    private Stage previousStage = Stage.UNKNOWN;
    private int handCount = 0;
    private String handFinishReason = NO_FINISH_YET;
}

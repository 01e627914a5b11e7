package org.pokersight.service.poker.stage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pokersight.model.poker.*;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StageTrackerTest {

    private StageTracker tracker;
    private HandProgress progress;

    @BeforeEach
    void init() {
        tracker = new StageTracker();
        progress = new HandProgress();
    }

    private static List<Card> board(int n) {
        return Card.fullDeck().subList(0, n);
    }

    // --------------------------------------------------------------
    // classify()
    // --------------------------------------------------------------
    @Test
    void classify_exactCounts_fullConfidence() {
        assertThat(tracker.classify(board(0)).stage()).isEqualTo(Stage.PRE_FLOP);
        assertThat(tracker.classify(board(3)).stage()).isEqualTo(Stage.FLOP);
        assertThat(tracker.classify(board(4)).stage()).isEqualTo(Stage.TURN);
        StageInfo river = tracker.classify(board(5));
        assertThat(river.stage()).isEqualTo(Stage.RIVER);
        assertThat(river.confidence()).isEqualTo(1.0);
        assertThat(river.cards()).hasSize(5);
    }

    @Test
    void classify_oddCount_isUnknownWithReducedConfidence() {
        StageInfo two = tracker.classify(board(2));
        assertThat(two.stage()).isEqualTo(Stage.UNKNOWN);
        assertThat(two.expectedCount()).isZero();
        assertThat(two.confidence()).isEqualTo(0.6);
        assertThat(tracker.classify(board(1)).confidence()).isEqualTo(0.8);
    }

    // --------------------------------------------------------------
    // advance()
    // --------------------------------------------------------------
    @Test
    void advance_firstPreFlop_countsNewHand() {
        HandTransition t = tracker.advance(progress, Stage.PRE_FLOP);
        assertThat(t.kind()).isEqualTo(HandTransition.Kind.NEW_HAND);
        assertThat(progress.getHandCount()).isEqualTo(1);
        assertThat(progress.getHandFinishReason()).isEqualTo(HandProgress.NO_FINISH_YET);
    }

    @Test
    void advance_flopBackToNoCards_finishesHandEarly() {
        progress.setCurrentStage(Stage.FLOP);

        HandTransition t = tracker.advance(progress, Stage.PRE_FLOP);

        assertThat(t.kind()).isEqualTo(HandTransition.Kind.HAND_FINISHED);
        assertThat(t.handCounted()).isTrue();
        assertThat(progress.getHandCount()).isEqualTo(1);
        assertThat(progress.getHandFinishReason()).contains("Flop");
        assertThat(progress.getPreviousStage()).isEqualTo(Stage.FLOP);
    }

    @Test
    void advance_riverBackToNoCards_completesHand() {
        progress.setCurrentStage(Stage.RIVER);
        progress.setHandCount(4);

        tracker.advance(progress, Stage.PRE_FLOP);

        assertThat(progress.getHandCount()).isEqualTo(5);
        assertThat(progress.getHandFinishReason()).isEqualTo("Completed (River)");
    }

    @Test
    void advance_fullHand_countsOnce() {
        tracker.advance(progress, Stage.PRE_FLOP);
        assertThat(tracker.advance(progress, Stage.FLOP).kind()).isEqualTo(HandTransition.Kind.PROGRESSION);
        assertThat(tracker.advance(progress, Stage.FLOP).kind()).isEqualTo(HandTransition.Kind.NONE);
        tracker.advance(progress, Stage.TURN);
        tracker.advance(progress, Stage.RIVER);
        assertThat(progress.getHandCount()).isEqualTo(1);

        tracker.advance(progress, Stage.PRE_FLOP);
        assertThat(progress.getHandCount()).isEqualTo(2);
    }

    @Test
    void advance_riverToFlop_isBackwardAndNotCounted() {
        progress.setCurrentStage(Stage.RIVER);
        HandTransition t = tracker.advance(progress, Stage.FLOP);
        assertThat(t.kind()).isEqualTo(HandTransition.Kind.BACKWARD);
        assertThat(progress.getHandCount()).isZero();
        assertThat(progress.getCurrentStage()).isEqualTo(Stage.FLOP);
    }

    @Test
    void advance_skippedStageOrUnknown_isUnclassified() {
        progress.setCurrentStage(Stage.PRE_FLOP);
        assertThat(tracker.advance(progress, Stage.TURN).kind()).isEqualTo(HandTransition.Kind.UNCLASSIFIED);
        assertThat(tracker.advance(progress, Stage.UNKNOWN).kind()).isEqualTo(HandTransition.Kind.UNCLASSIFIED);
        assertThat(progress.getHandCount()).isZero();
    }
}

package org.pokersight.service.poker.stage;

import org.pokersight.model.poker.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Stage classification and hand boundary detection. Stateless: the per-session
 * {@link HandProgress} is passed in and updated.
 */
@Service
public class StageTracker {
    private final Logger log = LoggerFactory.getLogger(getClass());

    private static final Map<Stage, String> FINISH_REASONS = Map.of(
            Stage.FLOP, "Early Finish (Flop)",
            Stage.TURN, "Early Finish (Turn)",
            Stage.RIVER, "Completed (River)"
    );

    public StageInfo classify(List<Card> community) {
        int count = community.size();
        Stage stage = Stage.ofCommunityCount(count);
        int expected = stage.expectedCards();
        double confidence = count == expected ? 1.0 : Math.max(0.0, 1.0 - Math.abs(count - expected) / 5.0);
        return new StageInfo(stage, count, community, expected, confidence);
    }

    public HandTransition advance(HandProgress progress, Stage next) {
        Stage prev = progress.getCurrentStage();
        if (prev == next) return HandTransition.none(next);

        progress.setPreviousStage(prev);
        progress.setCurrentStage(next);

        if (next == Stage.PRE_FLOP && FINISH_REASONS.containsKey(prev)) {
            String reason = FINISH_REASONS.get(prev);
            progress.setHandCount(progress.getHandCount() + 1);
            progress.setHandFinishReason(reason);
            log.info("Hand finished: {} -> {} ({}), hand #{}", prev.label(), next.label(), reason, progress.getHandCount());
            return new HandTransition(HandTransition.Kind.HAND_FINISHED, prev, next, true, reason);
        }
        if (prev == Stage.UNKNOWN && next == Stage.PRE_FLOP) {
            progress.setHandCount(progress.getHandCount() + 1);
            log.info("New hand detected, hand #{}", progress.getHandCount());
            return new HandTransition(HandTransition.Kind.NEW_HAND, prev, next, true, null);
        }
        if (prev.order() >= 0 && next.order() == prev.order() + 1) {
            log.debug("Hand progression: {} -> {}", prev.label(), next.label());
            return new HandTransition(HandTransition.Kind.PROGRESSION, prev, next, false, null);
        }
        if (prev.order() > next.order() && next.order() >= 0 && next != Stage.PRE_FLOP) {
            log.warn("Unusual backward transition: {} -> {}", prev.label(), next.label());
            return new HandTransition(HandTransition.Kind.BACKWARD, prev, next, false, null);
        }
        log.debug("Unclassified stage change: {} -> {}", prev.label(), next.label());
        return new HandTransition(HandTransition.Kind.UNCLASSIFIED, prev, next, false, null);
    }
}

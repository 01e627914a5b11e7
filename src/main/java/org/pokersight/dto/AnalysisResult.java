package org.pokersight.dto;

import lombok.*;
import org.pokersight.dto.probability.ProbabilityAnalysisDto;
import org.pokersight.model.poker.HandTransition;
import org.pokersight.model.poker.Stage;

import java.util.List;

/**
 * Outcome of one analysis pass. Sections that could not be produced are null and, when the
 * cause was a bad reading, explained in {@code warnings}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisResult {
    private String sessionId;
    private long passNumber;
    private Stage stage;
    private int handCount;
    private double stageConfidence;
    private String handFinishReason;
    private HandTransition transition;
    private List<String> heroCards;
    private List<String> communityCards;
    private Double pot;
    private HandEvaluationDto handEvaluation;
    private DeckAnalysisDto deckAnalysis;
    private TournamentMetricsDto tournamentMetrics;
    private List<EliminationDto> eliminations;
    private ProbabilityAnalysisDto probabilityAnalysis;
    private List<String> warnings;
    private long processingTimeMs;
}

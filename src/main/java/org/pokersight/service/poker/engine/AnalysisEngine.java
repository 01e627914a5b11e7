package org.pokersight.service.poker.engine;

import lombok.RequiredArgsConstructor;
import org.pokersight.dto.*;
import org.pokersight.dto.probability.ProbabilityAnalysisDto;
import org.pokersight.model.poker.*;
import org.pokersight.model.poker.rules.HandRules;
import org.pokersight.model.poker.rules.PreflopRules;
import org.pokersight.model.poker.rules.StackRules;
import org.pokersight.service.poker.ledger.TournamentLedger;
import org.pokersight.service.poker.probability.ProbabilityEngine;
import org.pokersight.service.poker.registry.SessionRegistry;
import org.pokersight.service.poker.stage.StageTracker;
import org.pokersight.service.poker.util.Locks;
import org.pokersight.service.poker.util.SeatCensus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Runs one analysis pass per snapshot: card readings, deck, stage, hand strength, ledger,
 * probability. Passes on the same session never overlap.
 */
@Service
@RequiredArgsConstructor
public class AnalysisEngine {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final SessionRegistry registry;
    private final Locks locks;
    private final StageTracker stages;
    private final TournamentLedger ledger;
    private final Optional<ProbabilityEngine> probability;

    public AnalysisResult analyze(String sessionId, TableSnapshot snapshot) {
        synchronized (locks.of(sessionId)) {
            return runPass(registry.getOrCreate(sessionId), snapshot);
        }
    }

    public Optional<TournamentSummaryDto> tournament(String sessionId) {
        synchronized (locks.of(sessionId)) {
            return registry.find(sessionId).map(s -> {
                TournamentState state = s.getTournament();
                return TournamentSummaryDto.builder()
                        .sessionId(s.getId())
                        .passCount(s.getPassCount())
                        .handCount(s.getHandProgress().getHandCount())
                        .currentStage(s.getHandProgress().getCurrentStage().label())
                        .metrics(ledger.metrics(state))
                        .eliminations(state.getEliminations().stream().map(EliminationDto::of).toList())
                        .lastUpdate(state.getLastUpdate())
                        .build();
            });
        }
    }

    public boolean close(String sessionId) {
        synchronized (locks.of(sessionId)) {
            return registry.remove(sessionId);
        }
    }

    AnalysisResult runPass(AnalysisSession session, TableSnapshot snapshot) {
        long started = System.nanoTime();
        Instant now = Instant.now();
        long pass = session.nextPass(now);
        List<String> warnings = new ArrayList<>();

        // 1. readings -> cards
        Set<Card> seen = new HashSet<>();
        List<Card> hero = readCards(snapshot.getHeroCards(), "hero", seen, warnings);
        List<Card> board = readCards(snapshot.getCommunityCards(), "community", seen, warnings);

        // 2. deck
        Deck deck = new Deck();
        deck.markKnown(hero);
        deck.markKnown(board);

        // 3. stage
        StageInfo stageInfo = stages.classify(board);
        HandProgress progress = session.getHandProgress();
        HandTransition transition = stages.advance(progress, stageInfo.stage());
        if (stageInfo.stage() == Stage.UNKNOWN) {
            warnings.add("Unexpected community card count: " + stageInfo.cardCount());
        }

        // 4. hand strength
        HandEvaluation evaluation = evaluate(hero, board, warnings);

        // 5. ledger
        Map<SeatPosition, SeatReading> seats = seatReadings(snapshot.getTournamentSeats(), warnings);
        SeatCensus census = seats.isEmpty() ? SeatCensus.NONE : SeatCensus.of(seats.values());
        TournamentState state = session.getTournament();
        List<EliminationEvent> eliminated = List.of();
        if (!seats.isEmpty()) {
            eliminated = ledger.update(state, seats, snapshot.getBlinds(), now);
        } else {
            ledger.updateBlinds(state, snapshot.getBlinds());
        }
        if (hasText(snapshot.getBlinds()) && StackRules.parseBlinds(snapshot.getBlinds()).isEmpty()) {
            warnings.add("Unreadable blinds: '" + snapshot.getBlinds() + "'");
        }
        boolean tracked = !state.activeSeats().isEmpty() || !state.getEliminations().isEmpty();
        TournamentMetricsDto metrics = tracked ? ledger.metrics(state) : null;

        // 6. probability
        int estimated = census.estimatedActivePlayers(stageInfo.stage());
        int opponents;
        if (snapshot.getActiveOpponentCount() != null) {
            opponents = Math.max(1, snapshot.getActiveOpponentCount());
            estimated = opponents + 1;
        } else {
            opponents = Math.max(1, estimated - 1);
        }
        int dealtIn = census.hasSeatData() ? census.activeSeated() : estimated;
        ProbabilityAnalysisDto probabilityAnalysis = probability(hero, board, stageInfo.stage(), opponents, dealtIn, warnings);

        Double pot = StackRules.parsePot(snapshot.getPot()).orElse(null);
        if (pot == null && hasText(snapshot.getPot())) warnings.add("Unreadable pot: '" + snapshot.getPot() + "'");

        DeckAnalysisDto deckAnalysis = DeckAnalysisDto.builder()
                .knownCount(deck.knownCount())
                .unknownCount(deck.unknownCount())
                .knownCards(deck.knownCards().stream().map(Card::toText).toList())
                .seatedPlayers(census.seated())
                .sittingOutPlayers(census.sittingOut())
                .activeSeatedPlayers(census.activeSeated())
                .eliminatedPlayers(state.getEliminations().size())
                .remainingDeckSize(ProbabilityEngine.remainingDeckSize(board.size(), dealtIn))
                .estimatedActivePlayers(estimated)
                .build();

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        log.debug("Session {} pass #{}: {} in {} ms, {} warning(s)",
                session.getId(), pass, stageInfo.stage().label(), elapsedMs, warnings.size());

        return AnalysisResult.builder()
                .sessionId(session.getId())
                .passNumber(pass)
                .stage(stageInfo.stage())
                .handCount(progress.getHandCount())
                .stageConfidence(stageInfo.confidence())
                .handFinishReason(progress.getHandFinishReason())
                .transition(transition)
                .heroCards(hero.stream().map(Card::toText).toList())
                .communityCards(board.stream().map(Card::toText).toList())
                .pot(pot)
                .handEvaluation(evaluation == null ? null : HandEvaluationDto.of(evaluation))
                .deckAnalysis(deckAnalysis)
                .tournamentMetrics(metrics)
                .eliminations(eliminated.stream().map(EliminationDto::of).toList())
                .probabilityAnalysis(probabilityAnalysis)
                .warnings(List.copyOf(warnings))
                .processingTimeMs(elapsedMs)
                .build();
    }

    /** Parsed cards only; a card already read elsewhere in this snapshot is dropped. */
    List<Card> readCards(List<String> texts, String slot, Set<Card> seen, List<String> warnings) {
        List<Card> out = new ArrayList<>();
        if (texts == null) return out;
        for (String raw : texts) {
            CardReading r = CardReading.of(raw);
            switch (r.status()) {
                case PARSED -> {
                    if (seen.add(r.card())) out.add(r.card());
                    else warnings.add("Duplicate " + slot + " card ignored: " + r.card().toText());
                }
                case PARSE_ERROR -> {
                    log.debug("Unreadable {} card '{}': {}", slot, raw, r.error());
                    warnings.add("Unreadable " + slot + " card: '" + raw + "'");
                }
                default -> { }
            }
        }
        return out;
    }

    private HandEvaluation evaluate(List<Card> hero, List<Card> board, List<String> warnings) {
        if (hero.size() != 2) return null;
        try {
            if (board.isEmpty()) return PreflopRules.evaluate(hero);
            if (board.size() < 3) return null;
            List<Card> all = new ArrayList<>(hero);
            all.addAll(board);
            return HandRules.evaluate(all);
        } catch (IllegalArgumentException ex) {
            log.warn("Hand evaluation failed for {} + {}: {}", hero, board, ex.getMessage());
            warnings.add("Hand evaluation failed: " + ex.getMessage());
            return null;
        }
    }

    private ProbabilityAnalysisDto probability(List<Card> hero, List<Card> board, Stage stage,
                                               int opponents, int dealtIn, List<String> warnings) {
        if (probability.isEmpty()) return null;
        if (hero.size() != 2 || stage == Stage.UNKNOWN) return null;
        try {
            return probability.get().analyze(hero, board, opponents, dealtIn);
        } catch (RuntimeException ex) {
            log.warn("Probability analysis failed: {}", ex.getMessage(), ex);
            warnings.add("Probability analysis unavailable: " + ex.getMessage());
            return null;
        }
    }

    private Map<SeatPosition, SeatReading> seatReadings(Map<String, SeatReading> raw, List<String> warnings) {
        Map<SeatPosition, SeatReading> out = new EnumMap<>(SeatPosition.class);
        if (raw == null) return out;
        raw.forEach((key, reading) -> {
            Optional<SeatPosition> pos = SeatPosition.fromKey(key);
            if (pos.isEmpty()) {
                log.debug("Ignoring unknown seat key '{}'", key);
                warnings.add("Unknown seat ignored: '" + key + "'");
            } else if (reading != null) {
                out.put(pos.get(), reading);
            }
        });
        return out;
    }

    private static boolean hasText(String s) { return s != null && !s.isBlank(); }
}

package org.pokersight.service.poker.probability;

import org.pokersight.dto.probability.EquityDto;
import org.pokersight.dto.probability.OpponentProfileDto;
import org.pokersight.dto.probability.ProbabilityAnalysisDto;
import org.pokersight.model.poker.Card;
import org.pokersight.model.poker.Deck;
import org.pokersight.model.poker.HandCategory;
import org.pokersight.model.poker.HandEvaluation;
import org.pokersight.model.poker.rules.BoardRules;
import org.pokersight.model.poker.rules.HandRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Win/tie/lose estimation, board texture and outs for the hero.
 *
 * <p>On a complete board the hero is compared with sampled opponent holdings; the chance of
 * beating all {@code n} opponents is taken as {@code singleWinRate^n}. That treats opponents'
 * hands as independent and ignores card removal between them, which is accepted here.
 * Before the river the engine returns an opponent-count estimate flagged as not simulated.
 */
@Service
@ConditionalOnProperty(name = "poker.probability.enabled", havingValue = "true", matchIfMissing = true)
public class ProbabilityEngine {
    private final Logger log = LoggerFactory.getLogger(getClass());
    static final int MAX_PAIRS = 47 * 46 / 2;

    private final Random random;
    private final int sampleSize;
    private final int profileSampleSize;
    private final double tieDiscount;

    public ProbabilityEngine(Random equityRandom,
                             @Value("${poker.equity.sample-size:200}") int sampleSize,
                             @Value("${poker.equity.profile-sample-size:100}") int profileSampleSize,
                             @Value("${poker.equity.tie-discount:0.5}") double tieDiscount) {
        this.random = equityRandom;
        this.sampleSize = Math.max(1, Math.min(MAX_PAIRS, sampleSize));
        this.profileSampleSize = Math.max(0, Math.min(MAX_PAIRS, profileSampleSize));
        this.tieDiscount = Math.max(0.0, Math.min(1.0, tieDiscount));
    }

    public ProbabilityAnalysisDto analyze(List<Card> hole, List<Card> board, int opponents, int activePlayers) {
        int opp = Math.max(1, opponents);
        return ProbabilityAnalysisDto.builder()
                .opponents(opp)
                .activePlayers(activePlayers)
                .remainingDeckSize(remainingDeckSize(board.size(), activePlayers))
                .equity(equity(hole, board, opp))
                .boardTexture(BoardRules.texture(board, opp))
                .outs(BoardRules.outs(hole, board))
                .opponentProfile(board.size() >= 3 ? profile(hole, board) : null)
                .build();
    }

    /** 52 - community - 2 per player dealt in, hero included. */
    public static int remainingDeckSize(int communityCount, int activePlayers) {
        return Math.max(0, 52 - communityCount - 2 * Math.max(0, activePlayers));
    }

    public EquityDto equity(List<Card> hole, List<Card> board, int opponents) {
        if (hole.size() != 2) throw new IllegalArgumentException("Equity needs the 2 hole cards, got " + hole.size());
        if (board.size() > 5) throw new IllegalArgumentException("At most 5 community cards, got " + board.size());
        int opp = Math.max(1, opponents);
        if (board.size() == 5) {
            EquityDto simulated = simulateShowdown(hole, board, opp);
            if (simulated != null) return simulated;
        }
        return estimate(board.size(), opp);
    }

    EquityDto simulateShowdown(List<Card> hole, List<Card> board, int opponents) {
        List<Card> heroCards = new ArrayList<>(hole);
        heroCards.addAll(board);
        HandEvaluation hero = HandRules.evaluate(heroCards);

        int wins = 0, ties = 0, losses = 0;
        for (Card[] pair : samplePairs(hole, board, sampleSize)) {
            try {
                List<Card> oppCards = new ArrayList<>(board);
                oppCards.add(pair[0]);
                oppCards.add(pair[1]);
                int opp = HandRules.evaluate(oppCards).score();
                if (hero.score() > opp) wins++;
                else if (hero.score() == opp) ties++;
                else losses++;
            } catch (IllegalArgumentException ex) {
                log.debug("Skipping opponent sample {} {}: {}", pair[0], pair[1], ex.getMessage());
            }
        }
        int total = wins + ties + losses;
        if (total == 0) return null;

        double single = wins / (double) total;
        double win = Math.pow(single, opponents);
        double tie = (ties / (double) total) * Math.pow(tieDiscount, opponents - 1);
        log.debug("Single-opponent win rate {} over {} samples, {} opponents -> {}", single, total, opponents, win);
        return bounded(win * 100, tie * 100, true, total, single * 100, opponents);
    }

    EquityDto estimate(int boardSize, int opponents) {
        double base;
        if (opponents == 1) base = 45.0;
        else if (opponents == 2) base = 30.0;
        else if (opponents <= 4) base = 20.0;
        else if (opponents <= 6) base = 15.0;
        else base = 10.0;
        if (boardSize >= 3) base *= 1.1;
        return bounded(base, 3.0, false, 0, null, opponents);
    }

    OpponentProfileDto profile(List<Card> hole, List<Card> board) {
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (HandCategory c : HandCategory.values()) categories.put(c.label(), 0);
        long sum = 0;
        int n = 0;
        for (Card[] pair : samplePairs(hole, board, profileSampleSize)) {
            List<Card> cards = new ArrayList<>(board);
            cards.add(pair[0]);
            cards.add(pair[1]);
            try {
                HandEvaluation ev = HandRules.evaluate(cards);
                categories.merge(ev.category().label(), 1, Integer::sum);
                sum += ev.score();
                n++;
            } catch (IllegalArgumentException ex) {
                log.debug("Skipping profile sample: {}", ex.getMessage());
            }
        }
        return OpponentProfileDto.builder()
                .sampleSize(n)
                .averageScore(n == 0 ? 0.0 : sum / (double) n)
                .categories(categories)
                .build();
    }

    /** Random distinct two-card holdings from the cards neither in the hole nor on the board. */
    List<Card[]> samplePairs(List<Card> hole, List<Card> board, int limit) {
        Deck deck = new Deck();
        deck.markKnown(hole);
        deck.markKnown(board);
        List<Card> pool = deck.unknownCards();

        List<Card[]> pairs = new ArrayList<>(pool.size() * (pool.size() - 1) / 2);
        for (int i = 0; i < pool.size(); i++)
            for (int j = i + 1; j < pool.size(); j++) pairs.add(new Card[]{pool.get(i), pool.get(j)});
        Collections.shuffle(pairs, random);
        return pairs.subList(0, Math.min(limit, pairs.size()));
    }

    private static EquityDto bounded(double win, double tie, boolean simulated, int total, Double single, int opponents) {
        double w = round1(clamp(win));
        double t = round1(clamp(Math.min(tie, 100.0 - w)));
        double l = round1(clamp(100.0 - w - t));
        return EquityDto.builder()
                .winPercentage(w)
                .tiePercentage(t)
                .losePercentage(l)
                .simulated(simulated)
                .totalSimulations(total)
                .singleOpponentWinRate(single == null ? null : round1(single))
                .opponents(opponents)
                .build();
    }

    private static double clamp(double pct) { return Math.max(0.0, Math.min(100.0, pct)); }
    private static double round1(double v) { return Math.round(v * 10.0) / 10.0; }
}

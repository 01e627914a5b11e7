package org.pokersight.service.poker.ledger;

import org.pokersight.dto.SeatReading;
import org.pokersight.dto.SeatSummaryDto;
import org.pokersight.dto.TournamentMetricsDto;
import org.pokersight.model.poker.*;
import org.pokersight.model.poker.rules.StackRules;
import org.pokersight.model.poker.rules.StackRules.StackParse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Seat-by-seat bookkeeping of a tournament across snapshots. Holds no state of its own:
 * every call works on the {@link TournamentState} it is given.
 */
@Service
public class TournamentLedger {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final double minConfidence;
    private final double emptySeatConfidence;

    public TournamentLedger(@Value("${poker.ledger.min-confidence:0.5}") double minConfidence,
                            @Value("${poker.ledger.empty-seat-confidence:0.3}") double emptySeatConfidence) {
        this.minConfidence = clamp01(minConfidence);
        this.emptySeatConfidence = clamp01(emptySeatConfidence);
    }

    public SeatRecord candidate(SeatPosition position, SeatReading reading, Long bigBlind, Instant now) {
        SeatRecord c = new SeatRecord(position, now);
        c.setName(SeatRecord.UNKNOWN);
        double confidence = 0.0;

        String cleaned = reading.getName() == null ? "" : reading.getName().strip().replaceAll("[^A-Za-z0-9_]", "");
        if (cleaned.length() > 2) {
            c.setName(cleaned);
            confidence += 0.3;
        }

        StackParse stack = StackRules.parseStack(reading.getStack());
        Long chips = stack.chips();
        Double bb = stack.bbSize();
        if (stack.status() == StackParse.Status.BB_ONLY && bigBlind != null && bigBlind > 0) {
            chips = Math.round(bb * bigBlind);
        } else if (stack.hasChips() && bb == null && bigBlind != null && bigBlind > 0) {
            bb = Math.round(chips * 10.0 / bigBlind) / 10.0;
        }
        if (stack.status() == StackParse.Status.UNPARSEABLE) {
            log.debug("Stack text '{}' at {} not parseable, chips left unset", reading.getStack(), position.key());
        }
        if (chips != null) {
            c.setChips(chips);
            c.setBbSize(bb);
            confidence += 0.7;
        }
        c.setConfidence(Math.min(1.0, confidence));
        return c;
    }

    /**
     * Applies one snapshot of seat readings: eliminations first, then confident candidates.
     *
     * @return the eliminations detected in this snapshot, in seat order
     */
    public List<EliminationEvent> update(TournamentState state, Map<SeatPosition, SeatReading> readings,
                                         String blindsText, Instant now) {
        updateBlinds(state, blindsText);

        Map<SeatPosition, SeatRecord> candidates = new EnumMap<>(SeatPosition.class);
        readings.forEach((pos, r) -> {
            if (r == null) return;
            boolean hasName = r.getName() != null && !r.getName().isBlank();
            boolean hasStack = r.getStack() != null && !r.getStack().isBlank();
            if (hasName || hasStack) candidates.put(pos, candidate(pos, r, state.getBigBlind(), now));
        });

        List<EliminationEvent> eliminations = detectEliminations(state, candidates, now);
        Set<SeatPosition> eliminatedNow = EnumSet.noneOf(SeatPosition.class);
        eliminations.forEach(e -> eliminatedNow.add(e.position()));

        for (SeatRecord c : candidates.values()) {
            if (eliminatedNow.contains(c.getPosition())) continue;
            // a stored empty-seat signature would be eliminated again on the next pass
            if (c.getConfidence() > minConfidence && !looksEliminated(c)) state.getSeats().put(c.getPosition(), c);
        }

        state.setLastUpdate(now);
        state.setTotalChips(state.activeSeats().stream().mapToLong(SeatRecord::getChips).sum());
        if (!eliminations.isEmpty()) {
            log.info("Tournament update: {} players remaining", state.activeSeats().size());
        }
        return eliminations;
    }

    /** Keeps the previous blinds when the text is missing or unreadable. */
    public boolean updateBlinds(TournamentState state, String blindsText) {
        Optional<StackRules.Blinds> blinds = StackRules.parseBlinds(blindsText);
        blinds.ifPresent(b -> {
            if (!Objects.equals(state.getBigBlind(), b.big())) {
                log.info("Blinds now {}/{}", b.small(), b.big());
            }
            state.setSmallBlind(b.small());
            state.setBigBlind(b.big());
        });
        return blinds.isPresent();
    }

    List<EliminationEvent> detectEliminations(TournamentState state, Map<SeatPosition, SeatRecord> candidates, Instant now) {
        List<EliminationEvent> out = new ArrayList<>();
        int activeBefore = state.activeSeats().size();
        for (SeatPosition pos : SeatPosition.values()) {
            SeatRecord current = state.seat(pos);
            if (!current.isActive()) continue;
            SeatRecord next = candidates.get(pos);
            if (next != null && !looksEliminated(next)) continue;

            EliminationEvent e = new EliminationEvent(pos, current.getName(), current.getChips(), now, activeBefore - out.size());
            out.add(e);
            state.getEliminations().add(e);
            state.getSeats().put(pos, SeatRecord.empty(pos, now));
            log.info("Player eliminated: {} at {} (last stack {}), finished #{}",
                    e.playerName(), pos.key(), e.lastStack(), e.finishingPlace());
        }
        return out;
    }

    /** Zero/negative chips or an empty-seat signature. Unset chips alone do not count. */
    private boolean looksEliminated(SeatRecord c) {
        if (c.getChips() != null && c.getChips() <= 0) return true;
        String name = c.getName();
        if (name == null || name.isBlank() || SeatRecord.UNKNOWN.equals(name) || SeatRecord.EMPTY.equals(name)) return true;
        return c.getConfidence() < emptySeatConfidence;
    }

    public TournamentMetricsDto metrics(TournamentState state) {
        List<SeatRecord> active = state.activeSeats();
        // List.sort is stable: equal stacks keep seat order
        List<SeatRecord> byChips = new ArrayList<>(active);
        byChips.sort(Comparator.comparingLong(SeatRecord::getChips).reversed());

        long total = active.stream().mapToLong(SeatRecord::getChips).sum();
        SeatRecord leader = byChips.isEmpty() ? null : byChips.get(0);
        SeatRecord shortest = null;
        for (SeatRecord s : active) {
            if (shortest == null || s.getChips() < shortest.getChips()) shortest = s;
        }

        List<SeatSummaryDto> standings = new ArrayList<>();
        for (SeatRecord s : byChips) standings.add(summary(s, standings.size() + 1));
        List<EliminationEvent> out = new ArrayList<>(state.getEliminations());
        Collections.reverse(out);
        for (EliminationEvent e : out) {
            standings.add(SeatSummaryDto.builder()
                    .rank(standings.size() + 1)
                    .position(e.position().key())
                    .name(e.playerName())
                    .chips(0L)
                    .active(false)
                    .finishingPlace(e.finishingPlace())
                    .build());
        }

        SeatRecord hero = state.seat(SeatPosition.HERO);
        Integer heroRank = null;
        double heroShare = 0.0;
        Double heroBb = null;
        if (hero.isActive()) {
            heroRank = byChips.indexOf(hero) + 1;
            heroShare = total > 0 ? hero.getChips() * 100.0 / total : 0.0;
            if (state.getBigBlind() != null && state.getBigBlind() > 0) {
                heroBb = hero.getChips() / (double) state.getBigBlind();
            }
        }

        return TournamentMetricsDto.builder()
                .activePlayers(active.size())
                .totalChips(total)
                .averageStack(active.isEmpty() ? 0.0 : total / (double) active.size())
                .chipLeader(leader == null ? null : summary(leader, 1))
                .shortStack(shortest == null ? null : summary(shortest, byChips.indexOf(shortest) + 1))
                .heroRank(heroRank)
                .heroChipShare(heroShare)
                .heroStackBb(heroBb)
                .smallBlind(state.getSmallBlind())
                .bigBlind(state.getBigBlind())
                .standings(standings)
                .build();
    }

    private SeatSummaryDto summary(SeatRecord s, int rank) {
        return SeatSummaryDto.builder()
                .rank(rank)
                .position(s.getPosition().key())
                .name(s.getName())
                .chips(s.getChips())
                .bbSize(s.getBbSize())
                .active(s.isActive())
                .build();
    }

    private static double clamp01(double v) { return Math.max(0.0, Math.min(1.0, v)); }
}

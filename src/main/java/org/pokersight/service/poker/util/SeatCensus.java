package org.pokersight.service.poker.util;

import org.pokersight.dto.SeatReading;
import org.pokersight.model.poker.Stage;

import java.util.Collection;
import java.util.Locale;

/**
 * Head count over the raw seat readings of one snapshot, and the player-count guess
 * the equity engine works with.
 */
public record SeatCensus(int seated, int sittingOut, int activeSeated) {

    public static final SeatCensus NONE = new SeatCensus(0, 0, 0);

    public static SeatCensus of(Collection<SeatReading> readings) {
        int seated = 0, out = 0;
        for (SeatReading r : readings) {
            if (r == null) continue;
            String name = r.getName() == null ? "" : r.getName().strip();
            String stack = r.getStack() == null ? "" : r.getStack().strip();
            if (name.isEmpty()) continue;
            seated++;
            if (isSittingOut(name, stack)) out++;
        }
        return new SeatCensus(seated, out, seated - out);
    }

    static boolean isSittingOut(String name, String stack) {
        String n = name.toLowerCase(Locale.ROOT);
        String s = stack.toLowerCase(Locale.ROOT);
        if (n.contains("sitting out") || s.contains("sitting out")) return true;
        if (n.contains("away") || n.contains("afk")) return true;
        return stack.isEmpty();
    }

    public boolean hasSeatData() { return seated > 0; }

    /** Players (hero included) expected to reach showdown at this stage. */
    public int estimatedActivePlayers(Stage stage) {
        if (!hasSeatData()) {
            return switch (stage) {
                case FLOP -> 4;
                case TURN, RIVER -> 3;
                default -> 6;
            };
        }
        int n = activeSeated;
        return switch (stage) {
            case RIVER -> clamp(n, 2, 3);
            case FLOP, TURN -> clamp(n, 3, 4);
            default -> Math.max(4, n);
        };
    }

    private static int clamp(int v, int lo, int hi) { return Math.max(lo, Math.min(hi, v)); }
}

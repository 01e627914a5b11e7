package org.pokersight.model.poker.rules;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of the free-text amounts read off the table: stacks, blinds and pot.
 */
public final class StackRules {
    private StackRules(){}

    public record StackParse(Status status, Long chips, Double bbSize) {
        public enum Status { NOT_RECOGNIZED, PARSED, BB_ONLY, UNPARSEABLE }

        public boolean hasChips() { return chips != null; }
    }

    public record Blinds(long small, long big) {}

    private static final Pattern BB = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*BB", Pattern.CASE_INSENSITIVE);

    // ordered, first match wins
    private static final Pattern THOUSANDS = Pattern.compile("(\\d{1,3}(?:,\\d{3})+)(\\s*[Kk](?![A-Za-z]))?");
    private static final Pattern K_SUFFIX = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*[Kk](?![A-Za-z])");
    private static final Pattern PLAIN = Pattern.compile("(\\d+)");
    private static final List<Pattern> CHIP_PATTERNS = List.of(THOUSANDS, K_SUFFIX, PLAIN);

    private static final Pattern BLINDS = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)\\s*([Kk])?\\s*/\\s*(\\d[\\d,]*(?:\\.\\d+)?)\\s*([Kk])?");
    private static final Pattern AMOUNT = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    public static StackParse parseStack(String text) {
        if (text == null || text.isBlank()) return new StackParse(StackParse.Status.NOT_RECOGNIZED, null, null);

        Double bb = null;
        String rest = text;
        Matcher bbm = BB.matcher(text);
        if (bbm.find()) {
            bb = Double.parseDouble(bbm.group(1));
            rest = text.substring(0, bbm.start()) + " " + text.substring(bbm.end());
        }

        Long chips = null;
        for (Pattern p : CHIP_PATTERNS) {
            Matcher m = p.matcher(rest);
            if (!m.find()) continue;
            String digits = m.group(1).replace(",", "");
            try {
                boolean thousands = p == K_SUFFIX || (p == THOUSANDS && m.group(2) != null);
                chips = thousands
                        ? Math.round(Double.parseDouble(digits) * 1000)
                        : Long.parseLong(digits);
                break;
            } catch (NumberFormatException ex) {
                // too long for a long: try the next shape
            }
        }

        if (chips != null) return new StackParse(StackParse.Status.PARSED, chips, bb);
        if (bb != null) return new StackParse(StackParse.Status.BB_ONLY, null, bb);
        return new StackParse(StackParse.Status.UNPARSEABLE, null, null);
    }

    public static Optional<Blinds> parseBlinds(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = BLINDS.matcher(text);
        if (!m.find()) return Optional.empty();
        long small = amount(m.group(1), m.group(2) != null);
        long big = amount(m.group(3), m.group(4) != null);
        if (small <= 0 || big <= 0 || small > big) return Optional.empty();
        return Optional.of(new Blinds(small, big));
    }

    /** "$52.20", "Pot: 1,250" -> amount; anything without a number -> empty. */
    public static Optional<Double> parsePot(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = AMOUNT.matcher(text.replace(",", ""));
        if (!m.find()) return Optional.empty();
        return Optional.of(Double.parseDouble(m.group(1)));
    }

    private static long amount(String digits, boolean thousands) {
        double v = Double.parseDouble(digits.replace(",", ""));
        return Math.round(thousands ? v * 1000 : v);
    }
}

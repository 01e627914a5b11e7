package org.pokersight.model.poker;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.pokersight.model.poker.exception.InvalidCardFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Getter
@EqualsAndHashCode
@AllArgsConstructor
public final class Card {
    private final Rank rank;
    private final Suit suit;

    private static final List<Card> FULL_DECK;
    static {
        List<Card> tmp = new ArrayList<>(52);
        for (Suit s : Suit.values()) {
            for (Rank r : Rank.values()) tmp.add(new Card(r, s));
        }
        FULL_DECK = Collections.unmodifiableList(tmp);
    }

    /** The 52 cards, suit-major then rank ascending. */
    public static List<Card> fullDeck() { return FULL_DECK; }

    /**
     * Parses "A♠", "10♦", "Kh", "td"... Rank first, suit last, case-insensitive.
     */
    public static Card parse(String text) {
        if (text == null) throw new InvalidCardFormatException(null, "no text");
        String t = text.strip().toUpperCase(Locale.ROOT);
        if (t.length() < 2) throw new InvalidCardFormatException(text, "too short");

        Suit suit = Suit.fromSymbol(t.charAt(t.length() - 1));
        if (suit == null) throw new InvalidCardFormatException(text, "unknown suit");
        Rank rank = Rank.fromToken(t.substring(0, t.length() - 1).strip());
        if (rank == null) throw new InvalidCardFormatException(text, "unknown rank");
        return new Card(rank, suit);
    }

    public String toText() { return rank.symbol() + suit.symbol(); }

    @Override
    public String toString() { return toText(); }

    public enum Suit {
        SPADES('♠', '♤', 'S'), HEARTS('♥', '♡', 'H'), DIAMONDS('♦', '♢', 'D'), CLUBS('♣', '♧', 'C');

        private final char symbol;
        private final char outline;
        private final char letter;

        Suit(char symbol, char outline, char letter) {
            this.symbol = symbol;
            this.outline = outline;
            this.letter = letter;
        }

        public char symbol() { return symbol; }

        static Suit fromSymbol(char c) {
            for (Suit s : values()) {
                if (s.symbol == c || s.outline == c || s.letter == c) return s;
            }
            return null;
        }
    }

    public enum Rank {
        TWO(2, "2", "Two", "Twos"), THREE(3, "3", "Three", "Threes"), FOUR(4, "4", "Four", "Fours"),
        FIVE(5, "5", "Five", "Fives"), SIX(6, "6", "Six", "Sixes"), SEVEN(7, "7", "Seven", "Sevens"),
        EIGHT(8, "8", "Eight", "Eights"), NINE(9, "9", "Nine", "Nines"), TEN(10, "10", "Ten", "Tens"),
        JACK(11, "J", "Jack", "Jacks"), QUEEN(12, "Q", "Queen", "Queens"), KING(13, "K", "King", "Kings"),
        ACE(14, "A", "Ace", "Aces");

        private final int value;
        private final String symbol;
        private final String label;
        private final String plural;

        Rank(int value, String symbol, String label, String plural) {
            this.value = value;
            this.symbol = symbol;
            this.label = label;
            this.plural = plural;
        }

        /** 2..14, Ace high. */
        public int value() { return value; }
        public String symbol() { return symbol; }
        public String label() { return label; }
        public String plural() { return plural; }

        public static Rank ofValue(int value) {
            for (Rank r : values()) if (r.value == value) return r;
            throw new IllegalArgumentException("No rank with value " + value);
        }

        static Rank fromToken(String token) {
            if ("T".equals(token)) return TEN;
            for (Rank r : values()) if (r.symbol.equals(token)) return r;
            return null;
        }
    }
}

package com.questrail.menton.symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * LaughNumerals
 * -----------------------------------------------------------------------------
 * Reads and spells "laugh numbers", the language's native numerals.
 *
 * <h2>Format</h2>
 * <ul>
 *   <li>Place tokens cycle every four decimal places:
 *       {@code 훠} (10^0, 10^4, ...), {@code 훳} (10^1, ...),
 *       {@code 허} (10^2, ...), {@code 헛} (10^3, ...)</li>
 *   <li>Digit 0 is omitted; 1-5 repeat the place token; 6-9 are
 *       {@value #FIVE_PREFIX} followed by the place token repeated (d - 5) times</li>
 *   <li>Digits are written from the largest place to the smallest</li>
 *   <li>{@value #ZERO_GROUP} stands for a whole four-digit group of zeros</li>
 *   <li>A leading {@value #NEGATIVE_PREFIX} negates the value</li>
 * </ul>
 *
 * <p>Because place tokens repeat every four places, a spelling is read with
 * the smallest starting power that matches its first place token; larger
 * starting powers (+4, +8, ...) are tried only when the smaller one does not
 * produce a valid reading. Skipping four or more places without
 * {@value #ZERO_GROUP} is invalid.</p>
 */
public final class LaughNumerals
{
    public static final String NEGATIVE_PREFIX = "뭐꼬";
    public static final String FIVE_PREFIX = "훠러";
    public static final char ZERO_GROUP = '찢';

    /** Largest power of ten representable in a {@code long}. */
    private static final int MAX_POWER = 18;
    private static final long[] POWERS_OF_TEN = new long[MAX_POWER + 1];

    static {
        POWERS_OF_TEN[0] = 1L;
        for (int k = 1; k <= MAX_POWER; k++) {
            POWERS_OF_TEN[k] = POWERS_OF_TEN[k - 1] * 10L;
        }
    }

    /**
     * Place tokens, indexed by power of ten modulo four.
     */
    enum Place {
        ONES('훠'),
        TENS('훳'),
        HUNDREDS('허'),
        THOUSANDS('헛');

        private final char glyph;

        Place(char glyph) {
            this.glyph = glyph;
        }

        char glyph() {
            return glyph;
        }

        static Place forPower(int power) {
            return values()[power % 4];
        }

        static Place forGlyph(char glyph) {
            for (Place place : values()) {
                if (place.glyph == glyph) {
                    return place;
                }
            }
            return null;
        }
    }

    /**
     * One tokenised item: a digit at a place, or a whole zero group when
     * {@code place} is null.
     */
    private record Item(Place place, int digit) {
        static final Item ZERO_GROUP_ITEM = new Item(null, 0);

        boolean isZeroGroup() {
            return place == null;
        }
    }

    private LaughNumerals() {}

    /**
     * Parses a laugh number.
     *
     * @param text candidate numeral; surrounding whitespace is ignored
     * @return the value, or empty if the text is not a valid laugh number or
     *         does not fit in a {@code long}
     */
    public static OptionalLong parse(String text)
    {
        Objects.requireNonNull(text, "text");

        String raw = text.strip();
        boolean negative = false;
        if (raw.startsWith(NEGATIVE_PREFIX)) {
            negative = true;
            raw = raw.substring(NEGATIVE_PREFIX.length()).strip();
        }
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }

        final List<Item> items = tokenize(raw);
        if (items == null) {
            return OptionalLong.empty();
        }

        Place first = null;
        for (Item item : items) {
            if (!item.isZeroGroup()) {
                first = item.place();
                break;
            }
        }
        if (first == null) {
            // A zero group alone has no anchor.
            return OptionalLong.empty();
        }

        for (int startPower = first.ordinal(); startPower <= MAX_POWER; startPower += 4) {
            final long value;
            try {
                value = evaluate(items, startPower);
            }
            catch (ArithmeticException overflow) {
                // Larger start powers only grow the value.
                return OptionalLong.empty();
            }
            if (value >= 0) {
                return OptionalLong.of(negative ? -value : value);
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Returns the canonical spelling of a value between 1 and 9999 in
     * magnitude.
     *
     * @throws IllegalArgumentException if the magnitude is outside 1..9999
     */
    public static String spell(long value)
    {
        long magnitude = Math.abs(value);
        if (magnitude < 1 || magnitude > 9999) {
            throw new IllegalArgumentException("Only magnitudes 1..9999 can be spelled (was " + value + ")");
        }

        StringBuilder out = new StringBuilder();
        if (value < 0) {
            out.append(NEGATIVE_PREFIX);
        }
        for (int power = 3; power >= 0; power--) {
            int digit = (int) ((magnitude / POWERS_OF_TEN[power]) % 10);
            if (digit == 0) {
                continue;
            }
            char glyph = Place.forPower(power).glyph();
            int repeat = digit;
            if (digit > 5) {
                out.append(FIVE_PREFIX);
                repeat = digit - 5;
            }
            for (int i = 0; i < repeat; i++) {
                out.append(glyph);
            }
        }
        return out.toString();
    }

    private static List<Item> tokenize(String raw)
    {
        List<Item> items = new ArrayList<>();
        int i = 0;
        while (i < raw.length()) {
            if (raw.charAt(i) == ZERO_GROUP) {
                items.add(Item.ZERO_GROUP_ITEM);
                i++;
                continue;
            }

            boolean aboveFive = raw.startsWith(FIVE_PREFIX, i);
            if (aboveFive) {
                i += FIVE_PREFIX.length();
                if (i >= raw.length()) {
                    return null;
                }
            }

            final char glyph = raw.charAt(i);
            final Place place = Place.forGlyph(glyph);
            if (place == null) {
                return null;
            }

            int count = 0;
            while (i < raw.length() && raw.charAt(i) == glyph) {
                count++;
                i++;
            }

            if (aboveFive) {
                if (count > 4) {
                    return null;
                }
                items.add(new Item(place, 5 + count));
            }
            else {
                if (count > 5) {
                    return null;
                }
                items.add(new Item(place, count));
            }
        }
        return items;
    }

    /**
     * Evaluates the items with the first digit at {@code startPower}.
     *
     * @return the value, or -1 if the items do not fit this start power
     * @throws ArithmeticException if the value overflows a {@code long}
     */
    private static long evaluate(List<Item> items, int startPower)
    {
        int power = startPower;
        long value = 0;
        int skippedInGroup = 0;

        for (Item item : items) {
            if (item.isZeroGroup()) {
                power -= 4;
                if (power < 0) {
                    return -1;
                }
                skippedInGroup = 0;
                continue;
            }

            while (power >= 0 && Place.forPower(power) != item.place()) {
                power--;
                skippedInGroup++;
                if (skippedInGroup >= 4) {
                    return -1;
                }
            }
            if (power < 0) {
                return -1;
            }

            value = Math.addExact(value, Math.multiplyExact(item.digit(), POWERS_OF_TEN[power]));
            power--;
            skippedInGroup++;
            if (skippedInGroup >= 4) {
                skippedInGroup = 0;
            }
        }
        return value;
    }
}

package com.questrail.menton.symbol;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Numeral reader accepting decimal digits or laugh numbers.
 */
public final class Numerals
{
    private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]+");

    private Numerals() {}

    /**
     * Parses a numeral operand.
     *
     * <p>Decimal digits (with an optional sign) are tried first, then
     * {@link LaughNumerals}.</p>
     *
     * @return the value, or empty if the text is neither form or overflows
     */
    public static OptionalLong parse(String text)
    {
        Objects.requireNonNull(text, "text");

        String trimmed = text.strip();
        if (DECIMAL.matcher(trimmed).matches()) {
            try {
                return OptionalLong.of(Long.parseLong(trimmed));
            }
            catch (NumberFormatException tooLarge) {
                return OptionalLong.empty();
            }
        }
        return LaughNumerals.parse(trimmed);
    }
}

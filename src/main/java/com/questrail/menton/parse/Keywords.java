package com.questrail.menton.parse;

/**
 * Statement keywords recognised outside utterances.
 *
 * <p>Keywords marked "prefix" are matched with {@link String#startsWith} and
 * take an operand from the rest of the line; the others must match the whole
 * line exactly.</p>
 */
public final class Keywords
{
    /** Prefix. Sets the current register; operand optional (0). */
    public static final String SET = "하요하요";

    /** Exact. Resets the current register to 0. */
    public static final String RESET = "바요바요";

    /** Prefix. Adds to the current register; operand optional (1). */
    public static final String ADD = "누이 좋고";

    /** Prefix. Subtracts from the current register; operand optional (1). */
    public static final String SUBTRACT = "매부 좋고";

    /** Prefix. Multiplies the current register; operand required. */
    public static final String MULTIPLY = "아주 좋고";

    /** Prefix. Opens a conditional block. */
    public static final String IF = "건방진";

    /** Exact. Switches an open conditional block to its else branch. */
    public static final String ELSE = "정신이 나갔어 정신이";

    /** Prefix. Opens a loop. */
    public static final String WHILE = "좋다좋다";

    /** Exact. Closes the innermost open block. */
    public static final String END = "쉐끼마";

    private Keywords() {}
}

package com.questrail.menton.symbol;

/**
 * StandardSymbolTable
 * -----------------------------------------------------------------------------
 * The process-wide default {@link SymbolTable}.
 *
 * <h2>Entries</h2>
 * <ul>
 *   <li>The laugh-number spelling of every code 1..{@value #MAX_CODE}</li>
 *   <li>The decimal spelling of every code 0..{@value #MAX_CODE}</li>
 *   <li>{@value #SPACE_SHORTCUT} for a space and {@value #NEWLINE_SHORTCUT}
 *       for a line feed</li>
 * </ul>
 *
 * <p>The entries are materialised once, on first use, and shared read-only
 * afterwards. Lookups stay exact-match table reads.</p>
 */
public final class StandardSymbolTable
{
    public static final int MAX_CODE = 255;
    public static final String SPACE_SHORTCUT = "~";
    public static final String NEWLINE_SHORTCUT = "ㅢ?!";

    private StandardSymbolTable() {}

    /**
     * Returns the shared standard table.
     */
    public static SymbolTable get() {
        return Holder.TABLE;
    }

    private static final class Holder {
        static final SymbolTable TABLE = build();
    }

    static SymbolTable build()
    {
        HashSymbolTable.Builder builder = SymbolTable.builder();

        for (int code = 1; code <= MAX_CODE; code++) {
            builder.put(LaughNumerals.spell(code), code);
        }
        for (int code = 0; code <= MAX_CODE; code++) {
            builder.put(Integer.toString(code), code);
        }
        builder.put(SPACE_SHORTCUT, ' ');
        builder.put(NEWLINE_SHORTCUT, '\n');

        return builder.build();
    }
}

/**
 * Glyph runs, numerals and the symbol table.
 *
 * <p>Lookup is exact-match on the complete glyph run. Laugh numerals are read
 * by {@link com.questrail.menton.symbol.LaughNumerals}; the standard table is
 * materialized once from their canonical spellings.</p>
 */
package com.questrail.menton.symbol;

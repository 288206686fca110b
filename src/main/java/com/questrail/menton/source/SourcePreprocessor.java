package com.questrail.menton.source;

import java.util.List;

/**
 * SourcePreprocessor
 * -----------------------------------------------------------------------------
 * First stage of a run: turns raw source text into logical lines.
 *
 * <p>The preprocessor is responsible only for:</p>
 * <ul>
 *   <li>Rejecting input that is not well-formed text</li>
 *   <li>Splitting physical lines and expanding in-line line breaks</li>
 *   <li>Removing comments and surrounding whitespace</li>
 *   <li>Keeping the physical line number of every logical line</li>
 * </ul>
 *
 * <p>It does not recognise markers, statements or glyphs.</p>
 *
 * <p>Implementations must be pure: identical input yields identical output.</p>
 */
@FunctionalInterface
public interface SourcePreprocessor
{
    /**
     * Preprocesses a complete source text.
     *
     * @param sourceText raw program text; never mutated
     * @return logical lines in source order
     * @throws com.questrail.menton.api.InputEncodingException if the text is not well-formed
     */
    List<LogicalLine> preprocess(CharSequence sourceText);
}

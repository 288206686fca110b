package com.questrail.menton.source.impl;

import com.questrail.menton.api.InputEncodingException;
import com.questrail.menton.source.LogicalLine;
import com.questrail.menton.source.SourcePreprocessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * DefaultSourcePreprocessor
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SourcePreprocessor}.
 *
 * <p>Each physical line goes through the following steps, in order:</p>
 * <ol>
 *   <li>Well-formedness check (no unpaired surrogates)</li>
 *   <li>Expansion of the in-line newline token {@value #NEWLINE_TOKEN}</li>
 *   <li>Comment removal from {@value #COMMENT_MARKER} to end of line</li>
 *   <li>Whitespace trimming</li>
 * </ol>
 *
 * <p>Lines left empty are dropped. Every retained line keeps the number of
 * the physical line it came from, including fragments produced by the
 * newline token.</p>
 */
public final class DefaultSourcePreprocessor implements SourcePreprocessor
{
    public static final String NEWLINE_TOKEN = "으이?";
    public static final char COMMENT_MARKER = '#';

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern PHYSICAL_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern NEWLINE_TOKEN_PATTERN = Pattern.compile(Pattern.quote(NEWLINE_TOKEN));

    @Override
    public List<LogicalLine> preprocess(CharSequence sourceText)
    {
        Objects.requireNonNull(sourceText, "sourceText");

        String text = sourceText.toString();
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        final String[] physical = PHYSICAL_BREAK.split(text, -1);
        final List<LogicalLine> lines = new ArrayList<>(physical.length);

        for (int i = 0; i < physical.length; i++) {
            final int lineNumber = i + 1;
            requireWellFormed(physical[i], lineNumber);

            for (String fragment : NEWLINE_TOKEN_PATTERN.split(physical[i], -1)) {
                String cleaned = clean(fragment);
                if (!cleaned.isEmpty()) {
                    lines.add(new LogicalLine(lineNumber, cleaned));
                }
            }
        }

        return Collections.unmodifiableList(lines);
    }

    static String clean(String fragment)
    {
        int comment = fragment.indexOf(COMMENT_MARKER);
        String code = (comment >= 0) ? fragment.substring(0, comment) : fragment;
        return code.strip();
    }

    private static void requireWellFormed(String line, int lineNumber)
    {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= line.length() || !Character.isLowSurrogate(line.charAt(i + 1))) {
                    throw new InputEncodingException(lineNumber, "unpaired high surrogate at column " + (i + 1));
                }
                i++;
            }
            else if (Character.isLowSurrogate(c)) {
                throw new InputEncodingException(lineNumber, "unpaired low surrogate at column " + (i + 1));
            }
        }
    }
}

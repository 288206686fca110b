package com.questrail.menton.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Delimiter lines recognised by the block parser.
 *
 * <p>Markers are matched against whole logical lines, exactly, after comment
 * stripping and trimming. All five must be distinct and non-blank.</p>
 *
 * @param utteranceStart   opens an utterance
 * @param characterEnd     closes an utterance whose lines decode to characters
 * @param numericEnd       closes an utterance whose lines print as decimal numbers
 * @param wordSeparator    closes the current word group and opens the next
 * @param controlMarker    annotation allowed once, immediately before an end marker
 */
public record MarkerSet(
        String utteranceStart,
        String characterEnd,
        String numericEnd,
        String wordSeparator,
        String controlMarker
) {
    public static final String DEFAULT_UTTERANCE_START = "와타시는";
    public static final String DEFAULT_CHARACTER_END = "한다는 것이야";
    public static final String DEFAULT_NUMERIC_END = "이라는 것이야";
    public static final String DEFAULT_WORD_SEPARATOR = "ㅡ";
    public static final String DEFAULT_CONTROL_MARKER = "?!";

    private static final MarkerSet DEFAULTS = new MarkerSet(
            DEFAULT_UTTERANCE_START,
            DEFAULT_CHARACTER_END,
            DEFAULT_NUMERIC_END,
            DEFAULT_WORD_SEPARATOR,
            DEFAULT_CONTROL_MARKER);

    public MarkerSet {
        List<String> all = List.of(
                requireMarker(utteranceStart, "utteranceStart"),
                requireMarker(characterEnd, "characterEnd"),
                requireMarker(numericEnd, "numericEnd"),
                requireMarker(wordSeparator, "wordSeparator"),
                requireMarker(controlMarker, "controlMarker"));

        Set<String> seen = new HashSet<>();
        for (String marker : all) {
            if (!seen.add(marker)) {
                throw new IllegalArgumentException("Duplicate marker: " + marker);
            }
        }
    }

    public static MarkerSet defaults() {
        return DEFAULTS;
    }

    /**
     * Returns true if the line closes an utterance in either output mode.
     */
    public boolean isEndMarker(String line) {
        return characterEnd.equals(line) || numericEnd.equals(line);
    }

    private static String requireMarker(String marker, String name) {
        Objects.requireNonNull(marker, name);
        if (marker.isBlank() || !marker.equals(marker.strip())) {
            throw new IllegalArgumentException(name + " must be non-blank and trimmed");
        }
        if (marker.indexOf('#') >= 0) {
            throw new IllegalArgumentException(name + " must not contain the comment marker");
        }
        return marker;
    }
}

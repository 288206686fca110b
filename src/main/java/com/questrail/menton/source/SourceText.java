package com.questrail.menton.source;

import com.questrail.menton.api.InputEncodingException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Strict conversion of raw bytes into source text.
 */
public final class SourceText
{
    private SourceText() {}

    /**
     * Decodes UTF-8 bytes, reporting rather than replacing malformed input.
     *
     * @throws InputEncodingException if the bytes are not valid UTF-8
     */
    public static String decodeUtf8(byte[] utf8)
    {
        Objects.requireNonNull(utf8, "utf8");

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(utf8)).toString();
        }
        catch (CharacterCodingException e) {
            throw new InputEncodingException("source is not valid UTF-8", e);
        }
    }
}

package org.foxesworld.hoard.core.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Strict text decoding: malformed input is an error, not a replacement character.
 * A leading UTF-8 BOM is dropped.
 */
public final class TextParser extends ByteParser<String> {

    private final Charset charset;

    public TextParser() {
        this(StandardCharsets.UTF_8);
    }

    public TextParser(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public Charset charset() {
        return charset;
    }

    @Override
    protected String parseBytes(byte[] data) throws IOException {
        int offset = 0;
        if (charset.equals(StandardCharsets.UTF_8) && data.length >= 3
                && (data[0] & 0xFF) == 0xEF && (data[1] & 0xFF) == 0xBB && (data[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, offset, data.length - offset))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Input is not valid " + charset.name(), e);
        }
    }
}

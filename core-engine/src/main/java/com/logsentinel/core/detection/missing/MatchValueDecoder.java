package com.logsentinel.core.detection.missing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;

/**
 * Turns matched values into channel text.
 *
 * <p>
 * Byte values are decoded with the configured charset. Input that is not
 * valid in that charset is rendered as an escaped literal
 * ({@code b'\xff\xfe'}), which keeps every byte recoverable and never fails
 * the record.
 * </p>
 */
public final class MatchValueDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(MatchValueDecoder.class);
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final Charset charset;

    public MatchValueDecoder(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    /**
     * @param value a matched value
     * @return its text form
     */
    public String decode(Object value) {
        if (value instanceof byte[] bytes) {
            return decodeBytes(bytes);
        }
        return String.valueOf(value);
    }

    private String decodeBytes(byte[] bytes) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            LOG.debug("Value is not valid {}, using escaped form: {}", charset, e.getMessage());
            return escape(bytes);
        }
    }

    /**
     * Render bytes as an escaped literal. Printable ASCII is kept, everything
     * else becomes {@code \xNN}.
     *
     * @param bytes raw bytes
     * @return escaped literal, e.g. {@code b'ab\x00'}
     */
    static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length + 3).append("b'");
        for (byte b : bytes) {
            int c = b & 0xff;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c >= 0x20 && c < 0x7f) {
                        sb.append((char) c);
                    } else {
                        sb.append("\\x").append(HEX[c >> 4]).append(HEX[c & 0xf]);
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }
}

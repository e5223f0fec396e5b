package com.logsentinel.core.detection.missing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MatchValueDecoder}.
 */
class MatchValueDecoderTest {

    private final MatchValueDecoder utf8 = new MatchValueDecoder(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Should pass strings through unchanged")
    void shouldKeepStrings() {
        assertThat(utf8.decode("host-1")).isEqualTo("host-1");
    }

    @Test
    @DisplayName("Should render other objects with toString")
    void shouldRenderNumbers() {
        assertThat(utf8.decode(42)).isEqualTo("42");
    }

    @Test
    @DisplayName("Should decode valid bytes with the configured charset")
    void shouldDecodeBytes() {
        assertThat(utf8.decode("grüße".getBytes(StandardCharsets.UTF_8))).isEqualTo("grüße");
    }

    @Test
    @DisplayName("Should fall back to an escaped literal for invalid bytes")
    void shouldEscapeInvalidBytes() {
        byte[] bytes = {'a', (byte) 0xff, (byte) 0xfe, 0x00};

        assertThat(utf8.decode(bytes)).isEqualTo("b'a\\xff\\xfe\\x00'");
    }

    @Test
    @DisplayName("Should escape quotes and backslashes in the literal")
    void shouldEscapeSpecialCharacters() {
        assertThat(MatchValueDecoder.escape(new byte[] {'\'', '\\', '\n'})).isEqualTo("b'\\'\\\\\\n'");
    }

    @Test
    @DisplayName("Should accept every byte with a single-byte charset")
    void shouldDecodeLatin1() {
        MatchValueDecoder latin1 = new MatchValueDecoder(StandardCharsets.ISO_8859_1);

        assertThat(latin1.decode(new byte[] {(byte) 0xe9})).isEqualTo("é");
    }
}

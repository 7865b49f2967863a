package com.endecrelay.relay.serial;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LineBuffer}.
 */
class LineBufferTest {

    private LineBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new LineBuffer();
    }

    @Test
    @DisplayName("Should split on newlines and drop carriage returns")
    void shouldSplitLines() {
        List<String> lines = append("<ENDECSTART>\r\nTake shelter\r\n");

        assertThat(lines).containsExactly("<ENDECSTART>", "Take shelter");
        assertThat(buffer.pendingBytes()).isZero();
    }

    @Test
    @DisplayName("Should hold a partial line until its newline arrives")
    void shouldKeepPartialLine() {
        assertThat(append("ZCZC-WXR-TOR-")).isEmpty();
        assertThat(buffer.pendingBytes()).isEqualTo(13);

        assertThat(append("048113\nnext")).containsExactly("ZCZC-WXR-TOR-048113");
        assertThat(buffer.pendingBytes()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should keep multi-byte characters split across reads intact")
    void shouldDecodeSplitUtf8() {
        byte[] bytes = "café\n".getBytes(StandardCharsets.UTF_8);

        assertThat(buffer.append(bytes, bytes.length - 2)).isEmpty();
        byte[] rest = { bytes[bytes.length - 2], bytes[bytes.length - 1] };

        assertThat(buffer.append(rest, rest.length)).containsExactly("café");
    }

    @Test
    @DisplayName("Should replace malformed bytes instead of failing")
    void shouldReplaceMalformedBytes() {
        byte[] bytes = { 'o', 'k', (byte) 0xFF, '\n' };

        assertThat(buffer.append(bytes, bytes.length)).containsExactly("ok\uFFFD");
    }

    @Test
    @DisplayName("Should emit empty lines for consecutive newlines")
    void shouldEmitEmptyLines() {
        assertThat(append("a\n\nb\n")).containsExactly("a", "", "b");
    }

    @Test
    @DisplayName("Should only consume the given length")
    void shouldRespectLength() {
        byte[] bytes = "one\ntwo\n".getBytes(StandardCharsets.US_ASCII);

        assertThat(buffer.append(bytes, 4)).containsExactly("one");
    }

    @Test
    @DisplayName("Should emit a run without a newline once it reaches the cap")
    void shouldCapPendingBytes() {
        LineBuffer capped = new LineBuffer(8);
        byte[] noise = "ABCDEFGHIJKL".getBytes(StandardCharsets.US_ASCII);

        assertThat(capped.append(noise, noise.length)).containsExactly("ABCDEFGH");
        assertThat(capped.pendingBytes()).isEqualTo(4);

        byte[] rest = "M\n".getBytes(StandardCharsets.US_ASCII);
        assertThat(capped.append(rest, rest.length)).containsExactly("IJKLM");
        assertThat(capped.pendingBytes()).isZero();
    }

    @Test
    @DisplayName("Should keep the default buffer bounded on a stream with no newlines")
    void shouldBoundDefaultBuffer() {
        byte[] noise = new byte[LineBuffer.DEFAULT_MAX_LINE_BYTES * 3 + 10];
        Arrays.fill(noise, (byte) 'x');

        List<String> lines = buffer.append(noise, noise.length);

        assertThat(lines).hasSize(3);
        assertThat(buffer.pendingBytes()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject a non-positive cap")
    void shouldRejectNonPositiveCap() {
        assertThatThrownBy(() -> new LineBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private List<String> append(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return buffer.append(bytes, bytes.length);
    }
}

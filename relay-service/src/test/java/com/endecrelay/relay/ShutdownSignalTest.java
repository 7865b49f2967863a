package com.endecrelay.relay;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ShutdownSignal}.
 */
class ShutdownSignalTest {

    @Test
    @DisplayName("Should complete a short pause when no shutdown is requested")
    void shouldCompletePause() {
        ShutdownSignal signal = new ShutdownSignal();

        assertThat(signal.pause(Duration.ofMillis(10))).isTrue();
        assertThat(signal.pause(Duration.ZERO)).isTrue();
        assertThat(signal.isRequested()).isFalse();
    }

    @Test
    @DisplayName("Should end a long pause as soon as shutdown is requested")
    void shouldInterruptPause() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        CompletableFuture<Boolean> paused = CompletableFuture.supplyAsync(() -> signal.pause(Duration.ofMinutes(5)));

        signal.request();

        assertThat(paused.get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(signal.pause(Duration.ofMinutes(5))).isFalse();
    }
}

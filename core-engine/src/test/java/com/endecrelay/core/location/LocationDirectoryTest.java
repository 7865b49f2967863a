package com.endecrelay.core.location;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LocationDirectory}.
 */
class LocationDirectoryTest {

    private LocationDirectory directory;

    @BeforeEach
    void setUp() {
        directory = LocationDirectory.fromClasspath("test-locations.txt");
    }

    @Test
    @DisplayName("Should skip malformed lines and keep the valid ones")
    void shouldSkipMalformedLines() {
        assertThat(directory.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should resolve a county code ignoring the subdivision digit")
    void shouldResolveCounty() {
        assertThat(directory.resolve("023005")).isEqualTo("Cumberland County, ME");
        assertThat(directory.resolve("723005")).isEqualTo("Cumberland County, ME");
    }

    @Test
    @DisplayName("Should resolve a statewide code to the state name only")
    void shouldResolveStatewide() {
        assertThat(directory.resolve("023000")).isEqualTo("Maine");
    }

    @Test
    @DisplayName("Should return placeholders for unknown codes")
    void shouldReturnPlaceholders() {
        assertThat(directory.resolve("023999")).isEqualTo(LocationDirectory.UNKNOWN_COUNTY);
        assertThat(directory.resolve("048000")).isEqualTo(LocationDirectory.UNKNOWN_STATE);
        assertThat(directory.resolve("12345")).isEqualTo(LocationDirectory.UNKNOWN_COUNTY);
        assertThat(directory.resolve("0A3005")).isEqualTo(LocationDirectory.UNKNOWN_COUNTY);
        assertThat(directory.resolve(null)).isEqualTo(LocationDirectory.UNKNOWN_COUNTY);
    }

    @Test
    @DisplayName("Should resolve everything to placeholders when empty")
    void shouldHandleEmptyDirectory() {
        LocationDirectory empty = LocationDirectory.empty();

        assertThat(empty.size()).isZero();
        assertThat(empty.resolve("023005")).isEqualTo(LocationDirectory.UNKNOWN_COUNTY);
    }

    @Test
    @DisplayName("Should bundle a default directory covering every state")
    void shouldLoadBundledDirectory() {
        LocationDirectory bundled = LocationDirectory.loadDefault();

        assertThat(bundled.resolve("048113")).isEqualTo("Dallas County, TX");
        assertThat(bundled.resolve("036000")).isEqualTo("New York");
        assertThat(bundled.size()).isGreaterThan(50);
    }

    @Test
    @DisplayName("Should load a directory from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("locations.txt");
        Files.writeString(file, "33000|New Hampshire\n33011|Hillsborough County, NH\n");

        LocationDirectory loaded = LocationDirectory.fromFile(file.toString());

        assertThat(loaded.resolve("033011")).isEqualTo("Hillsborough County, NH");
        assertThat(loaded.resolve("033000")).isEqualTo("New Hampshire");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> LocationDirectory.fromFile(dir.resolve("missing.txt").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}

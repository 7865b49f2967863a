package com.endecrelay.core.location;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from SAME location codes to human-readable names.
 *
 * <h3>Codes</h3>
 * <p>
 * A SAME location code has the form {@code PSSCCC}: a subdivision digit, a
 * two-digit state FIPS code and a three-digit county FIPS code. A county part
 * of {@code 000} addresses the whole state, so those codes resolve to the
 * state name only.
 * </p>
 *
 * <h3>Source format</h3>
 *
 * <pre>
 * # comment
 * 23000|Maine
 * 23005|Cumberland County, ME
 * </pre>
 *
 * <p>
 * Loaded once at startup via {@link #fromClasspath(String)} or
 * {@link #fromFile(String)}. Malformed lines are logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocationDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(LocationDirectory.class);

    /** Classpath resource bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "same-locations.txt";

    public static final String UNKNOWN_COUNTY = "Unknown County/Area";
    public static final String UNKNOWN_STATE = "Unknown State";

    private static final String STATEWIDE_SUFFIX = "000";

    /** Two-digit state FIPS to state name. */
    private final Map<String, String> states;

    /** Five-digit SSCCC to county name. */
    private final Map<String, String> counties;

    private LocationDirectory(Map<String, String> states, Map<String, String> counties) {
        this.states = Map.copyOf(states);
        this.counties = Map.copyOf(counties);
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @return a directory with no entries; every code resolves to a placeholder
     */
    public static LocationDirectory empty() {
        return new LocationDirectory(Map.of(), Map.of());
    }

    /**
     * Load the bundled directory, {@value #DEFAULT_RESOURCE}.
     *
     * @return the loaded directory
     */
    public static LocationDirectory loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load a directory from a file system path.
     *
     * @param path path to the directory file; must not be {@code null}
     * @return the loaded directory
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static LocationDirectory fromFile(String path) {
        Objects.requireNonNull(path, "Location file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parse(is, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Location file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read location file: " + path, e);
        }
    }

    /**
     * Load a directory from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return the loaded directory
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static LocationDirectory fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = LocationDirectory.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * Resolve a six-digit SAME location code to a display name.
     *
     * <p>
     * Never throws: codes that are not six digits, or that are missing from
     * the directory, resolve to {@value #UNKNOWN_COUNTY} (or
     * {@value #UNKNOWN_STATE} for statewide codes).
     * </p>
     *
     * @param code six-digit {@code PSSCCC} code
     * @return the state name for statewide codes, otherwise the county name
     */
    public String resolve(String code) {
        if (code == null || code.length() != 6 || !isDigits(code)) {
            return UNKNOWN_COUNTY;
        }
        if (code.endsWith(STATEWIDE_SUFFIX)) {
            return states.getOrDefault(code.substring(1, 3), UNKNOWN_STATE);
        }
        return counties.getOrDefault(code.substring(1), UNKNOWN_COUNTY);
    }

    public int size() {
        return states.size() + counties.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static LocationDirectory parse(InputStream is, String source) throws IOException {
        Map<String, String> states = new HashMap<>();
        Map<String, String> counties = new HashMap<>();

        BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int sep = trimmed.indexOf('|');
            String code = sep < 0 ? trimmed : trimmed.substring(0, sep).strip();
            String name = sep < 0 ? "" : trimmed.substring(sep + 1).strip();
            if (code.length() != 5 || !isDigits(code) || name.isEmpty()) {
                LOG.warn("Skipping malformed location entry at {}:{}: '{}'", source, lineNumber, line);
                continue;
            }
            if (code.endsWith(STATEWIDE_SUFFIX)) {
                states.put(code.substring(0, 2), name);
            } else {
                counties.put(code, name);
            }
        }

        LOG.info("Loaded {} state and {} county location(s) from {}", states.size(), counties.size(), source);
        return new LocationDirectory(states, counties);
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}

package com.shutterprobe.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates an {@link AnalysisProfile} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_PROFILE_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the profile after parsing and fails
 * fast with an {@link IllegalStateException} listing all problems.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisProfileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisProfileLoader.class);

    /** Environment variable that can override the default profile location. */
    public static final String ENV_PROFILE_PATH = "ANALYSIS_PROFILE_PATH";

    public static final String DEFAULT_RESOURCE = "analysis-profile.yml";

    private AnalysisProfileLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the profile using automatic resolution.
     *
     * @return parsed and validated profile
     * @throws IllegalStateException if validation fails
     */
    public static AnalysisProfile load() {
        return load(System.getenv(ENV_PROFILE_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, otherwise from
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param path file system path, may be {@code null} or blank
     * @return parsed and validated profile
     */
    public static AnalysisProfile load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading analysis profile from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading analysis profile from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated profile
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AnalysisProfile fromFile(String path) {
        Objects.requireNonNull(path, "Profile file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Analysis profile not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read analysis profile: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated profile
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AnalysisProfile fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisProfileLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisProfile parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisProfile.class, options));
        AnalysisProfile profile = yaml.load(is);

        if (profile == null) {
            LOG.warn("Analysis profile is empty – using defaults");
            profile = new AnalysisProfile();
        }
        profile.validate();

        LOG.info("Loaded analysis profile '{}': fps={} method={} expectedSpeeds={}",
                profile.getName(), profile.getRecordingFps(),
                profile.getThreshold().getMethod(), profile.getExpectedSpeeds().size());
        return profile;
    }
}

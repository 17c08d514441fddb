package com.threatsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and validates {@link RulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link RulesConfig#validate()} after parsing
 * so that the engine <strong>fails fast</strong> on invalid rules rather
 * than producing undefined runtime behaviour.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default rule set location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Classpath resource holding the built-in rule set. */
    public static final String DEFAULT_RESOURCE = "default-rules.yml";

    private RulesLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules using automatic resolution.
     *
     * <ol>
     * <li>If {@code RULES_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the
     * classpath.</li>
     * </ol>
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rules from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static RulesConfig fromFile(String path) {
        return YamlSupport.readFile(path, RulesLoader::parseAndValidate);
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or rule validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        return YamlSupport.readClasspath(resource, RulesLoader::parseAndValidate);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RulesConfig parseAndValidate(InputStream is) {
        RulesConfig config = YamlSupport.parse(is, RulesConfig.class);

        if (config == null || (config.getRules().isEmpty() && config.getCorrelationRules().isEmpty())) {
            LOG.warn("No detection or correlation rules defined in configuration");
            config = new RulesConfig();
        } else {
            // Fail fast if any rule is misconfigured
            config.validate();
        }

        LOG.info("Loaded {} detection rule(s) and {} correlation rule(s)",
                config.getRules().size(), config.getCorrelationRules().size());
        return config;
    }
}

package com.threatsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Loads and validates {@link SiemConfig}.
 *
 * <p>
 * Resolution mirrors {@link RulesLoader}: {@value #ENV_CONFIG_PATH} first,
 * then {@value #DEFAULT_RESOURCE} on the classpath. Addresses listed in the
 * comma-separated {@value #ENV_BLACKLISTED_IPS} variable are merged into the
 * static blacklist.
 * </p>
 *
 * @since 1.0.0
 */
public final class SiemConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SiemConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "SIEM_CONFIG_PATH";
    public static final String ENV_BLACKLISTED_IPS = "BLACKLISTED_IPS";
    public static final String DEFAULT_RESOURCE = "siem.yml";

    private SiemConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @return parsed and validated configuration, with environment blacklist
     *         entries merged in
     * @throws IllegalStateException if validation fails
     */
    public static SiemConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        SiemConfig config;
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading SIEM configuration from environment path: {}", envPath);
            config = fromFile(envPath);
        } else {
            LOG.info("Loading SIEM configuration from classpath: {}", DEFAULT_RESOURCE);
            config = fromClasspath(DEFAULT_RESOURCE);
        }
        mergeBlacklist(config, System.getenv(ENV_BLACKLISTED_IPS));
        return config;
    }

    public static SiemConfig fromFile(String path) {
        return YamlSupport.readFile(path, SiemConfigLoader::parseAndValidate);
    }

    public static SiemConfig fromClasspath(String resource) {
        return YamlSupport.readClasspath(resource, SiemConfigLoader::parseAndValidate);
    }

    /**
     * Merge a comma-separated address list into the configuration.
     *
     * @param csv value of {@value #ENV_BLACKLISTED_IPS}; may be {@code null}
     */
    static void mergeBlacklist(SiemConfig config, String csv) {
        if (csv == null || csv.isBlank()) {
            return;
        }
        config.addBlacklistedIps(Arrays.asList(csv.split(",")));
        LOG.info("Blacklist extended from {}: {} address(es) total",
                ENV_BLACKLISTED_IPS, config.getBlacklistedIps().size());
    }

    private static SiemConfig parseAndValidate(InputStream is) {
        SiemConfig config = YamlSupport.parse(is, SiemConfig.class);
        if (config == null) {
            LOG.warn("Empty SIEM configuration, using built-in defaults");
            config = SiemConfig.defaults();
        }
        config.validate();
        LOG.info("Loaded {}", config);
        return config;
    }
}

package me.christianrobert.pyibackport.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Backport defaults used by the REST layer when a request leaves them out.
 *
 * <p>Only the keys below are known. Values are checked and normalized on the way in, so the
 * typed getters never see a value they cannot read.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String DEFAULT_TARGET = "backport.default-target";
    public static final String INCLUDE_AST = "backport.include-ast";
    public static final String WILDCARD_DENYLIST = "backport.wildcard-denylist";

    private static final Set<String> KEYS = Set.of(DEFAULT_TARGET, INCLUDE_AST, WILDCARD_DENYLIST);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(DEFAULT_TARGET, PythonVersion.DEFAULT_TARGET.toString());
        configuration.put(INCLUDE_AST, false);
        configuration.put(WILDCARD_DENYLIST, "builtins,typing,typing_extensions");

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public PythonVersion getDefaultTarget() {
        return PythonVersion.parseTarget((String) configuration.get(DEFAULT_TARGET));
    }

    public boolean isIncludeAst() {
        return (Boolean) configuration.get(INCLUDE_AST);
    }

    /**
     * Modules whose wildcard imports are rejected, from the comma-separated setting
     * {@code "builtins,typing,typing_extensions"}.
     */
    public List<String> getWildcardDenylist() {
        return Arrays.stream(((String) configuration.get(WILDCARD_DENYLIST)).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Applies all entries, or none of them if one is invalid.
     *
     * @throws IllegalArgumentException for an unknown key or a value of the wrong shape
     */
    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        Map<String, Object> normalized = new LinkedHashMap<>();
        newConfig.forEach((key, value) -> normalized.put(key, normalize(key, value)));

        normalized.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    /**
     * @return the value as stored
     * @throws IllegalArgumentException for an unknown key or a value of the wrong shape
     */
    public Object setConfigValue(String key, Object value) {
        Object normalized = normalize(key, value);
        Object oldValue = configuration.put(key, normalized);
        log.debug("Config value set: {} = {} (was: {})", key, normalized, oldValue);
        return normalized;
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private static Object normalize(String key, Object value) {
        if (!KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
        if (value == null) {
            throw new IllegalArgumentException("Configuration value for " + key + " cannot be null");
        }

        switch (key) {
            case DEFAULT_TARGET:
                return PythonVersion.parseTarget(value.toString()).toString();
            case INCLUDE_AST:
                if (value instanceof Boolean) {
                    return value;
                }
                String flag = value.toString().trim();
                if (flag.equalsIgnoreCase("true") || flag.equalsIgnoreCase("false")) {
                    return Boolean.parseBoolean(flag);
                }
                throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
            default:
                // a JSON array or a comma-separated string
                if (value instanceof Collection) {
                    return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(","));
                }
                return value.toString();
        }
    }
}

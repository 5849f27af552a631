package com.coderocket.config;

import com.coderocket.model.AiBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layered configuration: built-in defaults, then ~/.coderocket/env, then ./.env, then
 * environment variables. The highest layer that defines a key wins.
 *
 * <p>The merged map is immutable and swapped in one step on reload, so readers never see
 * a half-merged state.
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    static final String GLOBAL_DIR_NAME = ".coderocket";
    static final String GLOBAL_FILE_NAME = "env";
    static final String PROJECT_FILE_NAME = ".env";

    private static final Map<AiBackend, ConfigKey> API_KEY_VARS = new EnumMap<>(Map.of(
            AiBackend.GEMINI, ConfigKey.GEMINI_API_KEY,
            AiBackend.CLAUDECODE, ConfigKey.CLAUDE_API_KEY
    ));
    private static final Map<AiBackend, ConfigKey> MODEL_VARS = new EnumMap<>(Map.of(
            AiBackend.GEMINI, ConfigKey.GEMINI_MODEL,
            AiBackend.CLAUDECODE, ConfigKey.CLAUDE_MODEL
    ));
    private static final Map<AiBackend, ConfigKey> BASE_URL_VARS = new EnumMap<>(Map.of(
            AiBackend.GEMINI, ConfigKey.GEMINI_BASE_URL,
            AiBackend.CLAUDECODE, ConfigKey.CLAUDE_BASE_URL
    ));

    private final Path projectDir;
    private final Path homeDir;
    private final Map<String, String> environment;

    private volatile Map<String, String> config;

    public ConfigStore(Path projectDir, Path homeDir, Map<String, String> environment) {
        this.projectDir = projectDir;
        this.homeDir = homeDir;
        this.environment = Map.copyOf(environment);
    }

    /**
     * Store bound to the working directory, home directory and environment of this JVM.
     */
    public static ConfigStore forCurrentProcess() {
        return new ConfigStore(
                Path.of(System.getProperty("user.dir")),
                Path.of(System.getProperty("user.home")),
                System.getenv());
    }

    public void initialize() {
        initialize(false);
    }

    /**
     * Merge all layers. A no-op when already initialized unless {@code forceReload} is set.
     */
    public synchronized void initialize(boolean forceReload) {
        if (config != null && !forceReload) return;

        Map<String, String> merged = new LinkedHashMap<>();
        for (ConfigKey key : ConfigKey.values()) {
            if (key.defaultValue() != null) {
                merged.put(key.name(), key.defaultValue());
            }
        }
        merged.putAll(readSettingsFile(getConfigPath(ConfigScope.GLOBAL).file()));
        merged.putAll(readSettingsFile(getConfigPath(ConfigScope.PROJECT).file()));
        for (ConfigKey key : ConfigKey.values()) {
            String value = environment.get(key.name());
            if (value != null && !value.isEmpty()) {
                merged.put(key.name(), value);
            }
        }

        config = Collections.unmodifiableMap(merged);
        log.debug("Configuration initialized: {}", snapshot());
    }

    public void reload() {
        initialize(true);
    }

    public boolean isInitialized() {
        return config != null;
    }

    public String get(String key, String defaultValue) {
        Map<String, String> current = config;
        if (current == null) {
            throw new ConfigNotReadyException();
        }
        return current.getOrDefault(key, defaultValue);
    }

    public String get(ConfigKey key) {
        return get(key.name(), key.defaultValue());
    }

    public int getTimeout() {
        return positiveInt(ConfigKey.AI_TIMEOUT);
    }

    public int getMaxRetries() {
        return positiveInt(ConfigKey.AI_MAX_RETRIES);
    }

    public int getFileContentCharLimit() {
        return positiveInt(ConfigKey.FILE_CONTENT_CHAR_LIMIT);
    }

    public boolean isAutoSwitchEnabled() {
        String value = get(ConfigKey.AI_AUTO_SWITCH).trim();
        if ("false".equalsIgnoreCase(value)) return false;
        if ("true".equalsIgnoreCase(value)) return true;
        return Boolean.parseBoolean(ConfigKey.AI_AUTO_SWITCH.defaultValue());
    }

    public AiBackend getPreferredBackend() {
        return AiBackend.normalize(get(ConfigKey.AI_SERVICE));
    }

    public String getLanguage() {
        return get(ConfigKey.AI_LANGUAGE);
    }

    public ConfigKey getApiKeyEnvVar(AiBackend backend) {
        return API_KEY_VARS.get(backend);
    }

    /**
     * Credential for a backend, or an empty string when none is configured.
     */
    public String getApiKey(AiBackend backend) {
        String value = get(getApiKeyEnvVar(backend).name(), "");
        return value == null ? "" : value.trim();
    }

    public String getModel(AiBackend backend) {
        return get(MODEL_VARS.get(backend));
    }

    public String getBaseUrl(AiBackend backend) {
        return get(BASE_URL_VARS.get(backend));
    }

    /**
     * Directory and file of the settings file for a scope.
     */
    public ConfigLocation getConfigPath(ConfigScope scope) {
        return switch (scope) {
            case GLOBAL -> {
                Path dir = homeDir.resolve(GLOBAL_DIR_NAME);
                yield new ConfigLocation(dir, dir.resolve(GLOBAL_FILE_NAME));
            }
            case PROJECT -> new ConfigLocation(projectDir, projectDir.resolve(PROJECT_FILE_NAME));
        };
    }

    public Path getProjectDir() {
        return projectDir;
    }

    public Path getHomeDir() {
        return homeDir;
    }

    /**
     * Copy of the merged configuration with credentials masked.
     */
    public Map<String, String> snapshot() {
        Map<String, String> current = config;
        if (current == null) {
            throw new ConfigNotReadyException();
        }
        Map<String, String> safe = new LinkedHashMap<>();
        current.forEach((key, value) -> {
            boolean secret = key.contains("API_KEY") || key.contains("TOKEN");
            safe.put(key, secret && value != null && !value.isEmpty() ? "***" : value);
        });
        return safe;
    }

    private int positiveInt(ConfigKey key) {
        int fallback = Integer.parseInt(key.defaultValue());
        try {
            int value = Integer.parseInt(get(key).trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, fallback);
            return fallback;
        }
    }

    private Map<String, String> readSettingsFile(Path file) {
        try {
            Map<String, String> entries = EnvFileParser.read(file);
            log.debug("Loaded settings from {}", file);
            return entries;
        } catch (NoSuchFileException e) {
            log.debug("Settings file {} not found, skipping", file);
        } catch (IOException e) {
            log.warn("Could not read settings file {}: {}", file, e.getMessage());
        }
        return Map.of();
    }
}

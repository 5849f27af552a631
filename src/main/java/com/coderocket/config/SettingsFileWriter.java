package com.coderocket.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists configuration changes to the settings file of a scope. The live
 * {@link ConfigStore} only sees the change after its next reload.
 */
public class SettingsFileWriter {

    private static final Logger log = LoggerFactory.getLogger(SettingsFileWriter.class);

    private final ConfigStore configStore;

    public SettingsFileWriter(ConfigStore configStore) {
        this.configStore = configStore;
    }

    /**
     * Merge {@code updates} over the existing file content and write it back.
     *
     * @return the file that was written
     */
    public Path write(ConfigScope scope, Map<String, String> updates) throws IOException {
        ConfigLocation location = configStore.getConfigPath(scope);
        Files.createDirectories(location.dir());

        Map<String, String> entries = new LinkedHashMap<>();
        if (Files.exists(location.file())) {
            // an unreadable file aborts the write instead of being replaced by the updates alone
            entries.putAll(EnvFileParser.read(location.file()));
        }
        entries.putAll(updates);

        Files.writeString(location.file(), EnvFileParser.render(entries), StandardCharsets.UTF_8);
        log.info("Wrote {} setting(s) to {}", updates.size(), location.file());
        return location.file();
    }
}

package com.coderocket.prompts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads prompt files from a directory on disk.
 */
public class DirectoryPromptSource implements PromptSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPromptSource.class);

    private final String name;
    private final Path dir;

    public DirectoryPromptSource(String name, Path dir) {
        this.name = name;
        this.dir = dir;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> find(String fileName) {
        Path file = dir.resolve(fileName);
        try {
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Could not read prompt file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String describe(String fileName) {
        return dir.resolve(fileName).toString();
    }
}

package com.coderocket.source;

import com.coderocket.model.FileContent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the files of a review request relative to a repository root.
 */
public class FileSource {

    static final long MAX_FILE_BYTES = 1024 * 1024;
    static final String TRUNCATION_MARKER = "\n\n[... content truncated ...]";

    /**
     * Read every file. Problems with a single file are reported in its {@link FileContent}
     * instead of failing the whole batch.
     */
    public List<FileContent> readAll(Path base, List<String> files, int charLimit) {
        List<FileContent> results = new ArrayList<>();
        for (String file : files) {
            results.add(read(base, file, charLimit));
        }
        return results;
    }

    FileContent read(Path base, String file, int charLimit) {
        if (!isValidPath(file)) {
            return FileContent.error(file, "Invalid file path");
        }
        Path resolved = resolvePath(file, base);
        if (!Files.exists(resolved)) {
            return FileContent.error(file, "File not found");
        }
        if (Files.isDirectory(resolved)) {
            return FileContent.error(file, "Path is a directory, not a file");
        }

        try {
            if (Files.size(resolved) > MAX_FILE_BYTES) {
                return FileContent.error(file, "File is larger than %d bytes".formatted(MAX_FILE_BYTES));
            }
            String content = new String(Files.readAllBytes(resolved), StandardCharsets.UTF_8);
            if (content.length() > charLimit) {
                content = content.substring(0, charLimit) + TRUNCATION_MARKER;
            }
            return FileContent.of(file, content);
        } catch (IOException e) {
            return FileContent.error(file, e.getMessage());
        }
    }

    /**
     * Rejects path traversal and NUL bytes.
     */
    public static boolean isValidPath(String path) {
        if (path == null || path.isBlank()) return false;
        return !path.contains("..") && !path.contains("\0");
    }

    static Path resolvePath(String filePath, Path base) {
        if (filePath.startsWith("~")) {
            filePath = System.getProperty("user.home") + filePath.substring(1);
        }
        Path p = Path.of(filePath);
        return p.isAbsolute() ? p : base.resolve(p);
    }
}

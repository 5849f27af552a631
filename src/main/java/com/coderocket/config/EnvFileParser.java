package com.coderocket.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code KEY=VALUE} settings files (.env style).
 */
public final class EnvFileParser {

    private EnvFileParser() {}

    /**
     * Parse settings file content. Blank lines, {@code #} comments and lines without a key
     * are skipped. Only the first {@code =} separates key from value.
     */
    public static Map<String, String> parse(String content) {
        Map<String, String> entries = new LinkedHashMap<>();
        if (content == null) return entries;

        for (String line : content.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            int eq = trimmed.indexOf('=');
            if (eq < 0) continue;

            String key = trimmed.substring(0, eq).trim();
            if (key.isEmpty()) continue;

            entries.put(key, stripQuotes(trimmed.substring(eq + 1).trim()));
        }
        return entries;
    }

    /**
     * Read and parse a settings file. Bytes that are not valid UTF-8 are replaced, so a
     * stray Latin-1 comment only affects its own line.
     */
    public static Map<String, String> read(Path file) throws IOException {
        return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    /**
     * Render entries back into settings file content, one pair per line.
     */
    public static String render(Map<String, String> entries) {
        StringBuilder sb = new StringBuilder();
        entries.forEach((key, value) -> sb.append(key).append('=').append(value).append('\n'));
        return sb.toString();
    }

    static String stripQuotes(String value) {
        String result = value;
        if (!result.isEmpty() && isQuote(result.charAt(0))) {
            result = result.substring(1);
        }
        if (!result.isEmpty() && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}

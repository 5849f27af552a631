package com.coderocket.prompts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves review instructions by logical key: ./prompts/, then ~/.coderocket/prompts/,
 * then built-in text. The first layer that has the file wins outright and the result is
 * cached until {@link #clearCache()}.
 *
 * <p>Every review key currently maps to the same prompt file; what differs between
 * review kinds is the content being reviewed.
 */
public class PromptStore {

    private static final Logger log = LoggerFactory.getLogger(PromptStore.class);

    public static final String BASE = "base";
    public static final String PROMPT_FILE = "git-commit-review-prompt.md";
    public static final String DEFAULT_LANGUAGE = "zh-CN";

    private static final String CONTENT_PLACEHOLDER = "{content}";

    private static final Map<String, String> PROMPT_FILES = new LinkedHashMap<>();

    static {
        for (String key : List.of("git_commit", "review_commit", "code_review", "review_code",
                "review_changes", "git_changes", "review_files", "file_review", BASE)) {
            PROMPT_FILES.put(key, PROMPT_FILE);
        }
    }

    private final List<PromptSource> sources;
    private final ConcurrentMap<String, String> cache = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    public PromptStore(List<PromptSource> sources) {
        this.sources = List.copyOf(sources);
    }

    /**
     * Store reading from {@code <projectDir>/prompts} and {@code <homeDir>/.coderocket/prompts}.
     */
    public static PromptStore forDirectories(Path projectDir, Path homeDir) {
        return new PromptStore(List.of(
                new DirectoryPromptSource("project", projectDir.resolve("prompts")),
                new DirectoryPromptSource("global", homeDir.resolve(".coderocket").resolve("prompts"))
        ));
    }

    /**
     * Resolve every known key once. Idempotent.
     */
    public synchronized void initialize() {
        if (initialized) return;
        initialized = true;
        for (String key : PROMPT_FILES.keySet()) {
            loadPrompt(key);
        }
        log.debug("Prompt store initialized with {} prompt(s)", cache.size());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Resolved prompt text for {@code key}.
     *
     * @throws PromptResolutionException when no layer and no built-in text has the key
     */
    public String loadPrompt(String key) {
        if (!initialized) {
            throw new IllegalStateException("PromptStore is not initialized, call initialize() first");
        }
        String cached = cache.get(key);
        if (cached != null) return cached;

        String resolved = resolve(key);
        String previous = cache.putIfAbsent(key, resolved);
        return previous != null ? previous : resolved;
    }

    /**
     * Prompt for {@code key} with {@code {name}} placeholders replaced. Unknown keys fall
     * back to the base prompt.
     */
    public String getPrompt(String key, Map<String, String> variables) {
        String prompt;
        try {
            prompt = loadPrompt(key);
        } catch (PromptResolutionException e) {
            log.warn("Prompt \"{}\" not found, using base prompt", key);
            prompt = loadPrompt(BASE);
        }
        if (variables != null) {
            for (Map.Entry<String, String> entry : variables.entrySet()) {
                prompt = prompt.replace("{" + entry.getKey() + "}", entry.getValue());
            }
        }
        return prompt;
    }

    public String getPrompt(String key) {
        return getPrompt(key, null);
    }

    /**
     * Compose the full prompt sent to a backend.
     *
     * <p>A custom prompt replaces the templates entirely; its {@code {content}} placeholder
     * receives the content (appended when there is no placeholder). Otherwise the result is
     * base prompt, key prompt, language directive and content, in that order.
     */
    public String buildPrompt(String key, String content, String customOverride, String languageCode) {
        if (customOverride != null && !customOverride.isBlank()) {
            if (customOverride.contains(CONTENT_PLACEHOLDER)) {
                return customOverride.replace(CONTENT_PLACEHOLDER, content);
            }
            return customOverride + "\n\n" + content;
        }

        String language = languageCode == null || languageCode.isBlank() ? DEFAULT_LANGUAGE : languageCode.trim();
        return getPrompt(BASE)
                + "\n\n" + getPrompt(key)
                + "\n\n" + languageDirective(language)
                + "\n\nContent:\n" + content;
    }

    static String languageDirective(String language) {
        return "Please respond in %s.".formatted(language);
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * Put text straight into the cache, bypassing file lookup until the cache is cleared.
     */
    public void setPrompt(String key, String content) {
        cache.put(key, content);
        log.debug("Prompt \"{}\" set directly", key);
    }

    public boolean hasPrompt(String key) {
        return cache.containsKey(key);
    }

    public Set<String> availablePrompts() {
        return new TreeSet<>(cache.keySet());
    }

    /**
     * Every location searched for {@code fileName}, in lookup order.
     */
    public List<String> getPromptPaths(String fileName) {
        return sources.stream().map(s -> s.describe(fileName)).toList();
    }

    private String resolve(String key) {
        String fileName = PROMPT_FILES.get(key);
        if (fileName != null) {
            for (PromptSource source : sources) {
                Optional<String> content = source.find(fileName).filter(c -> !c.isBlank());
                if (content.isPresent()) {
                    log.debug("Prompt \"{}\" loaded from {}", key, source.describe(fileName));
                    return content.get().trim();
                }
            }
            log.debug("Prompt file {} not found, using built-in prompt for \"{}\"", fileName, key);
        }
        return BuiltinPrompts.get(key)
                .map(String::trim)
                .orElseThrow(() -> new PromptResolutionException(key));
    }
}

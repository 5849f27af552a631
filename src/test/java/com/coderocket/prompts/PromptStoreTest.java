package com.coderocket.prompts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptStoreTest {

    @TempDir
    Path tmp;

    /** In-memory layer that counts lookups. */
    static class CountingSource implements PromptSource {
        final Map<String, String> files = new HashMap<>();
        final AtomicInteger lookups = new AtomicInteger();

        @Override
        public String name() {
            return "memory";
        }

        @Override
        public Optional<String> find(String fileName) {
            lookups.incrementAndGet();
            return Optional.ofNullable(files.get(fileName));
        }

        @Override
        public String describe(String fileName) {
            return "memory:" + fileName;
        }
    }

    private PromptStore initialized(PromptSource... sources) {
        PromptStore store = new PromptStore(List.of(sources));
        store.initialize();
        return store;
    }

    private static void write(Path dir, String content) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(PromptStore.PROMPT_FILE), content);
    }

    @Test
    @DisplayName("falls back to built-in prompts when no file exists")
    void builtinFallback() {
        PromptStore store = PromptStore.forDirectories(tmp.resolve("project"), tmp.resolve("home"));
        store.initialize();

        assertThat(store.getPrompt("review_code"))
                .isEqualTo("As a professional code reviewer, analyze the provided code snippet in depth.");
        assertThat(store.getPrompt(PromptStore.BASE)).startsWith("You are a professional code reviewer.");
    }

    @Test
    @DisplayName("project prompt wins over global prompt without merging")
    void projectWinsOverGlobal() throws IOException {
        write(tmp.resolve("project").resolve("prompts"), "  project rules \n");
        write(tmp.resolve("home").resolve(".coderocket").resolve("prompts"), "global rules");

        PromptStore store = PromptStore.forDirectories(tmp.resolve("project"), tmp.resolve("home"));
        store.initialize();

        assertThat(store.loadPrompt("review_changes")).isEqualTo("project rules");
        assertThat(store.loadPrompt("review_changes")).doesNotContain("global");
    }

    @Test
    @DisplayName("global prompt is used when the project has none")
    void globalUsedWhenProjectMissing() throws IOException {
        write(tmp.resolve("home").resolve(".coderocket").resolve("prompts"), "global rules");

        PromptStore store = PromptStore.forDirectories(tmp.resolve("project"), tmp.resolve("home"));
        store.initialize();

        assertThat(store.loadPrompt("review_commit")).isEqualTo("global rules");
    }

    @Test
    @DisplayName("blank prompt files are treated as absent")
    void blankFileIgnored() {
        CountingSource blank = new CountingSource();
        blank.files.put(PromptStore.PROMPT_FILE, "   \n");

        PromptStore store = initialized(blank);

        assertThat(store.loadPrompt("review_code")).startsWith("As a professional code reviewer");
    }

    @Test
    @DisplayName("each key is resolved once and then served from the cache")
    void cachesResolvedPrompts() {
        CountingSource source = new CountingSource();
        source.files.put(PromptStore.PROMPT_FILE, "from file");
        PromptStore store = initialized(source);
        int afterInit = source.lookups.get();

        store.loadPrompt("review_code");
        store.loadPrompt("review_code");
        store.initialize();

        assertThat(source.lookups.get()).isEqualTo(afterInit);
        assertThat(store.availablePrompts()).contains("base", "review_code", "git_commit");
    }

    @Test
    @DisplayName("cached text survives file changes until the cache is cleared")
    void clearCacheRereads() {
        CountingSource source = new CountingSource();
        source.files.put(PromptStore.PROMPT_FILE, "v1");
        PromptStore store = initialized(source);

        source.files.put(PromptStore.PROMPT_FILE, "v2");
        assertThat(store.loadPrompt("review_code")).isEqualTo("v1");

        store.clearCache();
        assertThat(store.hasPrompt("review_code")).isFalse();
        assertThat(store.loadPrompt("review_code")).isEqualTo("v2");
    }

    @Test
    @DisplayName("loading before initialize fails")
    void requiresInitialize() {
        PromptStore store = new PromptStore(List.of());

        assertThatThrownBy(() -> store.loadPrompt("base"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("unknown keys throw from loadPrompt and fall back to base in getPrompt")
    void unknownKeys() {
        PromptStore store = initialized();

        assertThatThrownBy(() -> store.loadPrompt("does_not_exist"))
                .isInstanceOf(PromptResolutionException.class);
        assertThat(store.getPrompt("does_not_exist")).isEqualTo(store.getPrompt(PromptStore.BASE));
    }

    @Test
    @DisplayName("getPrompt replaces every occurrence of each variable")
    void substitutesVariables() {
        PromptStore store = initialized();
        store.setPrompt("greeting", "Hi {name}, {name} again. Lang: {lang}");

        assertThat(store.getPrompt("greeting", Map.of("name", "Ada", "lang", "en")))
                .isEqualTo("Hi Ada, Ada again. Lang: en");
        assertThat(store.hasPrompt("greeting")).isTrue();
    }

    @Test
    @DisplayName("buildPrompt orders base, key prompt, language directive and content")
    void buildPromptOrder() {
        PromptStore store = initialized();
        store.setPrompt(PromptStore.BASE, "BASE");
        store.setPrompt("review_code", "KEY");

        String prompt = store.buildPrompt("review_code", "int x = 1;", null, "en");

        assertThat(prompt).isEqualTo("BASE\n\nKEY\n\nPlease respond in en.\n\nContent:\nint x = 1;");
    }

    @Test
    @DisplayName("buildPrompt defaults the language to zh-CN")
    void buildPromptDefaultLanguage() {
        PromptStore store = initialized();

        assertThat(store.buildPrompt("review_code", "x", null, null)).contains("Please respond in zh-CN.");
        assertThat(store.buildPrompt("review_code", "x", null, " ")).contains("Please respond in zh-CN.");
    }

    @Test
    @DisplayName("custom prompt replaces the templates and receives the content")
    void customOverride() {
        PromptStore store = initialized();

        assertThat(store.buildPrompt("review_code", "CODE", "Check {content} and {content}", "en"))
                .isEqualTo("Check CODE and CODE");
        assertThat(store.buildPrompt("review_code", "CODE", "Be brief.", "en"))
                .isEqualTo("Be brief.\n\nCODE");
    }

    @Test
    @DisplayName("lists searched paths in lookup order")
    void promptPaths() {
        PromptStore store = PromptStore.forDirectories(tmp.resolve("project"), tmp.resolve("home"));

        assertThat(store.getPromptPaths(PromptStore.PROMPT_FILE)).containsExactly(
                tmp.resolve("project").resolve("prompts").resolve(PromptStore.PROMPT_FILE).toString(),
                tmp.resolve("home").resolve(".coderocket").resolve("prompts")
                        .resolve(PromptStore.PROMPT_FILE).toString());
    }
}

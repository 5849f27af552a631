package com.coderocket.orchestrator;

import com.coderocket.backend.Backend;
import com.coderocket.backend.BackendException;
import com.coderocket.backend.BackendRegistry;
import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static com.coderocket.model.AiBackend.CLAUDECODE;
import static com.coderocket.model.AiBackend.GEMINI;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorTest {

    @TempDir
    Path tmp;

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private Orchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) orchestrator.close();
    }

    private Orchestrator orchestrator(Map<String, String> env, Backend... backends) {
        ConfigStore config = new ConfigStore(tmp, tmp, env);
        config.initialize();
        orchestrator = new Orchestrator(config, new BackendRegistry(List.of(backends)), sleeper, Backoff.exponential());
        return orchestrator;
    }

    private static Map<String, String> env(String... pairs) {
        Map<String, String> env = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }

    @Test
    @DisplayName("returns the preferred backend's text on first success")
    void firstTrySuccess() throws Exception {
        FakeBackend gemini = FakeBackend.succeeding(GEMINI, "looks good");
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "unused");

        InvocationResult result = orchestrator(env(), gemini, claude).invoke(GEMINI, "review this");

        assertThat(result.text()).isEqualTo("looks good");
        assertThat(result.usedBackend()).isEqualTo(GEMINI);
        assertThat(result.failedAttempts()).isEmpty();
        assertThat(gemini.prompts).containsExactly("review this");
        assertThat(claude.calls()).isZero();
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    @DisplayName("retries the same backend with backoff before succeeding")
    void retriesThenSucceeds() throws Exception {
        FakeBackend gemini = new FakeBackend(GEMINI, true).thenFail().thenFail().then("third time");
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "unused");

        InvocationResult result = orchestrator(env("AI_MAX_RETRIES", "3"), gemini, claude).invoke(GEMINI, "p");

        assertThat(result.text()).isEqualTo("third time");
        assertThat(result.usedBackend()).isEqualTo(GEMINI);
        assertThat(result.failedAttempts()).extracting(AttemptRecord::attempt).containsExactly(1, 2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("fails over to the next backend and reports which one served")
    void failsOver() throws Exception {
        FakeBackend gemini = FakeBackend.failing(GEMINI);
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "claude review");

        InvocationResult result = orchestrator(env(), gemini, claude).invoke(GEMINI, "p");

        assertThat(result.usedBackend()).isEqualTo(CLAUDECODE);
        assertThat(result.text()).isEqualTo("claude review");
        assertThat(gemini.calls()).isEqualTo(3);
        assertThat(claude.calls()).isEqualTo(1);
        assertThat(result.failedAttempts())
                .allSatisfy(a -> assertThat(a.backend()).isEqualTo(GEMINI))
                .hasSize(3);
        assertThat(result.attempts()).last().satisfies(a -> {
            assertThat(a.backend()).isEqualTo(CLAUDECODE);
            assertThat(a.success()).isTrue();
        });
        // no backoff after the last attempt on a backend
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("does not fall back when auto-switch is off")
    void noFallbackWhenDisabled() {
        FakeBackend gemini = FakeBackend.failing(GEMINI);
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "unused");
        Orchestrator orchestrator = orchestrator(env("AI_AUTO_SWITCH", "false", "AI_MAX_RETRIES", "2"), gemini, claude);

        assertThatThrownBy(() -> orchestrator.invoke(GEMINI, "p"))
                .isInstanceOfSatisfying(AllBackendsFailedException.class, e -> {
                    assertThat(e.getFailures()).containsOnlyKeys(GEMINI);
                    assertThat(e.getAttempts()).hasSize(2);
                })
                .hasMessageContaining("AI_AUTO_SWITCH=true");
        assertThat(gemini.calls()).isEqualTo(2);
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("aggregated failure lists every backend in the order tried")
    void allFail() {
        FakeBackend gemini = FakeBackend.failing(GEMINI);
        FakeBackend claude = FakeBackend.failing(CLAUDECODE);
        Orchestrator orchestrator = orchestrator(env("AI_MAX_RETRIES", "1"), gemini, claude);

        assertThatThrownBy(() -> orchestrator.invoke(CLAUDECODE, "p"))
                .isInstanceOfSatisfying(AllBackendsFailedException.class, e -> {
                    assertThat(e.getFailures().keySet()).containsExactly(CLAUDECODE, GEMINI);
                    assertThat(e.getMessage())
                            .startsWith("All AI services failed.")
                            .contains("claudecode: Claude API error (HTTP 500)")
                            .contains("gemini: Gemini API error (HTTP 500)")
                            .contains("GEMINI_API_KEY, CLAUDE_API_KEY")
                            .doesNotContain("AI_AUTO_SWITCH");
                    assertThat(e.getMessage().indexOf("claudecode:"))
                            .isLessThan(e.getMessage().indexOf("gemini:"));
                });
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    @DisplayName("skips backends without credentials and names them")
    void skipsUnconfigured() {
        FakeBackend gemini = FakeBackend.failing(GEMINI);
        FakeBackend claude = new FakeBackend(CLAUDECODE, false).then("never");
        Orchestrator orchestrator = orchestrator(env("AI_MAX_RETRIES", "1"), gemini, claude);

        assertThatThrownBy(() -> orchestrator.invoke(GEMINI, "p"))
                .isInstanceOfSatisfying(AllBackendsFailedException.class,
                        e -> assertThat(e.getSkipped()).containsExactly(CLAUDECODE))
                .hasMessageContaining("claudecode: skipped - not configured");
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("an unconfigured preferred backend falls through to a configured one")
    void preferredUnconfigured() throws Exception {
        FakeBackend gemini = FakeBackend.succeeding(GEMINI, "gemini review");
        FakeBackend claude = new FakeBackend(CLAUDECODE, false).then("never");

        InvocationResult result = orchestrator(env(), gemini, claude).invoke(CLAUDECODE, "p");

        assertThat(result.usedBackend()).isEqualTo(GEMINI);
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("unknown backend names resolve to the first backend")
    void normalizesPreferredName() throws Exception {
        FakeBackend gemini = FakeBackend.succeeding(GEMINI, "gemini review");
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "claude review");

        InvocationResult result = orchestrator(env(), gemini, claude).invoke("openai", "p");

        assertThat(result.usedBackend()).isEqualTo(GEMINI);
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("a missing preferred backend resolves to the first backend")
    void nullPreferredBackend() throws Exception {
        FakeBackend gemini = FakeBackend.succeeding(GEMINI, "gemini review");
        FakeBackend claude = FakeBackend.succeeding(CLAUDECODE, "claude review");

        InvocationResult result = orchestrator(env(), gemini, claude).invoke((AiBackend) null, "p");

        assertThat(result.text()).isEqualTo("gemini review");
        assertThat(result.usedBackend()).isEqualTo(GEMINI);
        assertThat(claude.calls()).isZero();
    }

    @Test
    @DisplayName("priority order puts configured backends before unconfigured ones")
    void priorityOrder() {
        Orchestrator orchestrator = orchestrator(env(),
                new FakeBackend(GEMINI, false), FakeBackend.succeeding(CLAUDECODE, "x"));

        assertThat(orchestrator.priorityOrder(CLAUDECODE, true)).containsExactly(CLAUDECODE, GEMINI);
        assertThat(orchestrator.priorityOrder(GEMINI, true)).containsExactly(GEMINI, CLAUDECODE);
        assertThat(orchestrator.priorityOrder(GEMINI, false)).containsExactly(GEMINI);
    }

    @Test
    @DisplayName("a call slower than AI_TIMEOUT counts as a failed attempt")
    void timesOut() {
        CountDownLatch release = new CountDownLatch(1);
        Backend slow = new Backend() {
            @Override
            public AiBackend id() {
                return GEMINI;
            }

            @Override
            public boolean isConfigured() {
                return true;
            }

            @Override
            public String invoke(String prompt) throws BackendException {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "too late";
            }
        };
        Orchestrator orchestrator = orchestrator(
                env("AI_TIMEOUT", "1", "AI_MAX_RETRIES", "1", "AI_AUTO_SWITCH", "false"),
                slow, FakeBackend.succeeding(CLAUDECODE, "unused"));

        try {
            assertThatThrownBy(() -> orchestrator.invoke(GEMINI, "p"))
                    .isInstanceOf(AllBackendsFailedException.class)
                    .hasMessageContaining("gemini call timed out after 1s");
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("probe reports reachability of configured backends only")
    void probe() {
        Orchestrator orchestrator = orchestrator(env(),
                FakeBackend.succeeding(GEMINI, "pong"), new FakeBackend(CLAUDECODE, false).then("x"));

        assertThat(orchestrator.probe(GEMINI)).isTrue();
        assertThat(orchestrator.probe(CLAUDECODE)).isFalse();
    }
}

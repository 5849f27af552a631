package com.coderocket.orchestrator;

import com.coderocket.backend.Backend;
import com.coderocket.backend.BackendException;
import com.coderocket.backend.BackendRegistry;
import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Sends a prompt to the preferred backend, retrying with exponential backoff, and fails
 * over to the other backends when auto-switch is enabled.
 *
 * <p>Priority order is the preferred backend followed by the remaining backends,
 * configured ones first. Backends without a credential are skipped. Attempts run strictly
 * one after another.
 *
 * <p>Each attempt is raced against {@code AI_TIMEOUT} on a worker thread. A call that
 * loses the race is abandoned, not cancelled: it may still finish in the background and
 * its result is ignored.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private static final String PROBE_PROMPT = "ping";

    private final ConfigStore config;
    private final BackendRegistry registry;
    private final Sleeper sleeper;
    private final Backoff backoff;
    private final ExecutorService executor;

    public Orchestrator(ConfigStore config, BackendRegistry registry) {
        this(config, registry, Sleeper.THREAD, Backoff.exponential());
    }

    public Orchestrator(ConfigStore config, BackendRegistry registry, Sleeper sleeper, Backoff backoff) {
        this.config = config;
        this.registry = registry;
        this.sleeper = sleeper;
        this.backoff = backoff;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Like {@link #invoke(AiBackend, String)}; an unknown or missing name means the first
     * known backend.
     */
    public InvocationResult invoke(String preferredName, String prompt) throws AllBackendsFailedException {
        return invoke(AiBackend.normalize(preferredName), prompt);
    }

    /**
     * Generate text for {@code prompt}.
     *
     * @return the text and the backend that produced it, which may differ from {@code preferred}
     * @throws AllBackendsFailedException when no eligible backend succeeded
     */
    public InvocationResult invoke(AiBackend preferred, String prompt) throws AllBackendsFailedException {
        if (preferred == null) {
            preferred = AiBackend.values()[0];
        }
        boolean autoSwitch = config.isAutoSwitchEnabled();
        int maxRetries = config.getMaxRetries();
        Duration timeout = Duration.ofSeconds(config.getTimeout());
        Retrier retrier = new Retrier(maxRetries, backoff, e -> true, sleeper);

        List<AttemptRecord> attempts = new ArrayList<>();
        Map<AiBackend, String> failures = new LinkedHashMap<>();
        List<AiBackend> skipped = new ArrayList<>();

        for (AiBackend id : priorityOrder(preferred, autoSwitch)) {
            Backend backend = registry.get(id);
            if (!backend.isConfigured()) {
                log.debug("Skipping {}: not configured", id);
                skipped.add(id);
                continue;
            }

            try {
                String text = retrier.execute(
                        attempt -> {
                            String result = callWithTimeout(backend, prompt, timeout);
                            attempts.add(AttemptRecord.success(id, attempt));
                            return result;
                        },
                        (attempt, error) -> {
                            String message = Retrier.describe(error);
                            attempts.add(AttemptRecord.failure(id, attempt, message));
                            log.warn("{} attempt {}/{} failed: {}", id, attempt, maxRetries, message);
                        });
                if (id != preferred) {
                    log.info("Switched from {} to {}", preferred, id);
                }
                return new InvocationResult(text, id, List.copyOf(attempts));
            } catch (RetryExhaustedException e) {
                failures.put(id, Retrier.describe(e.getLastFailure()));
                log.warn("{} failed after {} attempt(s)", id, e.getAttempts());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AllBackendsFailedException("Interrupted while calling AI backends",
                        failures, skipped, attempts);
            }
        }

        throw new AllBackendsFailedException(failureMessage(failures, skipped, autoSwitch),
                failures, skipped, attempts);
    }

    /**
     * Backends to try, in order. Only the preferred one when auto-switch is off.
     */
    List<AiBackend> priorityOrder(AiBackend preferred, boolean autoSwitch) {
        List<AiBackend> order = new ArrayList<>();
        order.add(preferred);
        if (!autoSwitch) return order;

        List<AiBackend> others = new ArrayList<>(Arrays.asList(AiBackend.values()));
        others.remove(preferred);
        others.sort(Comparator.comparing(id -> !registry.get(id).isConfigured()));
        order.addAll(others);
        return order;
    }

    /**
     * Single timed call with no retries, used for connectivity checks.
     */
    public boolean probe(AiBackend id) {
        Backend backend = registry.get(id);
        if (!backend.isConfigured()) return false;
        try {
            callWithTimeout(backend, PROBE_PROMPT, Duration.ofSeconds(config.getTimeout()));
            return true;
        } catch (BackendException e) {
            log.warn("{} is configured but not reachable: {}", id, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String callWithTimeout(Backend backend, String prompt, Duration timeout)
            throws BackendException, InterruptedException {
        Future<String> future = executor.submit(() -> backend.invoke(prompt));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new BackendException(backend.id(), "%s call timed out after %ds"
                    .formatted(backend.name(), timeout.toSeconds()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException backendError) {
                throw backendError;
            }
            throw new BackendException(backend.id(), "%s call failed: %s"
                    .formatted(backend.name(), Retrier.describe(cause)), cause);
        }
    }

    private String failureMessage(Map<AiBackend, String> failures, List<AiBackend> skipped, boolean autoSwitch) {
        StringBuilder sb = new StringBuilder("All AI services failed.");
        failures.forEach((id, reason) -> sb.append("\n  - ").append(id).append(": ").append(reason));
        skipped.forEach(id -> sb.append("\n  - ").append(id).append(": skipped - not configured"));

        String keys = Arrays.stream(AiBackend.values())
                .map(id -> config.getApiKeyEnvVar(id).name())
                .collect(Collectors.joining(", "));
        sb.append("\nCheck that the API keys (").append(keys).append(") are set");
        if (!autoSwitch) {
            sb.append(" and enable AI_AUTO_SWITCH=true to fall back to other services");
        }
        sb.append('.');
        return sb.toString();
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "coderocket-backend-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

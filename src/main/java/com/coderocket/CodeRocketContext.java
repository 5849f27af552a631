package com.coderocket;

import com.coderocket.backend.BackendRegistry;
import com.coderocket.config.ConfigStore;
import com.coderocket.orchestrator.Orchestrator;
import com.coderocket.prompts.PromptStore;
import com.coderocket.service.ReviewService;
import com.coderocket.source.FileSource;
import com.coderocket.source.GitSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the stores, backends and services together once per process.
 */
public class CodeRocketContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CodeRocketContext.class);

    private final ConfigStore config;
    private final PromptStore prompts;
    private final BackendRegistry registry;
    private final Orchestrator orchestrator;
    private final ReviewService reviewService;

    public CodeRocketContext(ConfigStore config, PromptStore prompts) {
        config.initialize();
        prompts.initialize();
        log.debug("Configuration: {}", config.snapshot());

        this.config = config;
        this.prompts = prompts;
        this.registry = BackendRegistry.create(config);
        this.orchestrator = new Orchestrator(config, registry);
        this.reviewService = new ReviewService(config, prompts, orchestrator, registry,
                new GitSource(), new FileSource(), Clock.systemUTC());
    }

    public static CodeRocketContext create() {
        ConfigStore config = ConfigStore.forCurrentProcess();
        return new CodeRocketContext(config,
                PromptStore.forDirectories(config.getProjectDir(), config.getHomeDir()));
    }

    public ConfigStore config() {
        return config;
    }

    public PromptStore prompts() {
        return prompts;
    }

    public BackendRegistry registry() {
        return registry;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public ReviewService reviewService() {
        return reviewService;
    }

    @Override
    public void close() {
        orchestrator.close();
    }
}

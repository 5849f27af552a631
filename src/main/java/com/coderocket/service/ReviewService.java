package com.coderocket.service;

import com.coderocket.backend.Backend;
import com.coderocket.backend.BackendRegistry;
import com.coderocket.config.ConfigKey;
import com.coderocket.config.ConfigNotReadyException;
import com.coderocket.config.ConfigScope;
import com.coderocket.config.ConfigStore;
import com.coderocket.config.SettingsFileWriter;
import com.coderocket.model.AiBackend;
import com.coderocket.model.ConfigureRequest;
import com.coderocket.model.ConfigureResponse;
import com.coderocket.model.FileContent;
import com.coderocket.model.ReviewChangesRequest;
import com.coderocket.model.ReviewCodeRequest;
import com.coderocket.model.ReviewCommitRequest;
import com.coderocket.model.ReviewFilesRequest;
import com.coderocket.model.ReviewResponse;
import com.coderocket.model.ReviewStatus;
import com.coderocket.model.ServiceStatus;
import com.coderocket.orchestrator.AllBackendsFailedException;
import com.coderocket.orchestrator.InvocationResult;
import com.coderocket.orchestrator.Orchestrator;
import com.coderocket.prompts.PromptStore;
import com.coderocket.source.FileSource;
import com.coderocket.source.GitException;
import com.coderocket.source.GitSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entry point for review requests: gathers the content, composes the prompt and hands it
 * to the {@link Orchestrator}. Failures come back as {@link ReviewStatus#FAILED} responses
 * rather than exceptions.
 */
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private static final Pattern COMMIT_HASH = Pattern.compile("^[a-f0-9]{7,40}$", Pattern.CASE_INSENSITIVE);

    private final ConfigStore config;
    private final PromptStore prompts;
    private final Orchestrator orchestrator;
    private final BackendRegistry registry;
    private final GitSource git;
    private final FileSource files;
    private final SettingsFileWriter settingsWriter;
    private final Clock clock;

    public ReviewService(ConfigStore config, PromptStore prompts, Orchestrator orchestrator,
                         BackendRegistry registry, GitSource git, FileSource files, Clock clock) {
        if (!config.isInitialized()) {
            throw new ConfigNotReadyException();
        }
        this.config = config;
        this.prompts = prompts;
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.git = git;
        this.files = files;
        this.settingsWriter = new SettingsFileWriter(config);
        this.clock = clock;
    }

    public ReviewResponse reviewCode(ReviewCodeRequest request) {
        log.info("Reviewing code snippet ({} chars, language={})", request.code().length(), request.language());

        StringBuilder content = new StringBuilder();
        if (request.language() != null && !request.language().isBlank()) {
            content.append("Language: ").append(request.language()).append('\n');
        }
        if (request.context() != null && !request.context().isBlank()) {
            content.append("Context: ").append(request.context()).append('\n');
        }
        content.append("```").append(request.language() != null ? request.language() : "").append('\n')
                .append(request.code()).append("\n```");

        return review("Code review", "review_code", content.toString(), request.aiService(), request.customPrompt());
    }

    public ReviewResponse reviewChanges(ReviewChangesRequest request) {
        log.info("Reviewing changes in {} (staged={}, unstaged={})",
                request.repositoryPath(), request.includeStaged(), request.includeUnstaged());

        Path repo;
        try {
            repo = repositoryPath(request.repositoryPath());
        } catch (IllegalArgumentException e) {
            return failed("Changes review", e.getMessage(), request.aiService());
        }

        String changes = git.changes(repo, request.includeStaged(), request.includeUnstaged());
        if (changes.isBlank()) {
            return nothingToReview("No changes found", "There are no code changes to review.", request.aiService());
        }
        return review("Changes review", "review_changes", changes, request.aiService(), request.customPrompt());
    }

    public ReviewResponse reviewCommit(ReviewCommitRequest request) {
        log.info("Reviewing commit {} in {}", request.commitHash(), request.repositoryPath());

        String commitInfo;
        try {
            Path repo = repositoryPath(request.repositoryPath());
            if (request.commitHash() != null && !COMMIT_HASH.matcher(request.commitHash()).matches()) {
                throw new IllegalArgumentException("Invalid commit hash: " + request.commitHash());
            }
            commitInfo = git.show(repo, request.commitHash());
        } catch (IllegalArgumentException | GitException e) {
            log.error("Could not read commit", e);
            return failed("Commit review", e.getMessage(), request.aiService());
        }

        if (commitInfo.isBlank()) {
            return nothingToReview("No commit found", "Could not read the requested commit.", request.aiService());
        }
        return review("Commit review", "review_commit", commitInfo, request.aiService(), request.customPrompt());
    }

    public ReviewResponse reviewFiles(ReviewFilesRequest request) {
        log.info("Reviewing {} file(s) in {}", request.files().size(), request.repositoryPath());

        Path repo;
        try {
            repo = repositoryPath(request.repositoryPath());
        } catch (IllegalArgumentException e) {
            return failed("Files review", e.getMessage(), request.aiService());
        }

        List<FileContent> contents = files.readAll(repo, request.files(), config.getFileContentCharLimit());
        if (contents.stream().allMatch(FileContent::hasError)) {
            return nothingToReview("No readable files", fileReviewContent(contents), request.aiService());
        }
        return review("Files review", "review_files", fileReviewContent(contents),
                request.aiService(), request.customPrompt());
    }

    /**
     * Persist backend settings to the settings file of the requested scope, then reload.
     */
    public ConfigureResponse configureAiService(ConfigureRequest request) {
        AiBackend backend = AiBackend.fromName(request.service()).orElse(null);
        if (backend == null) {
            return new ConfigureResponse(false, "Unsupported AI service \"%s\". Supported: %s"
                    .formatted(request.service(), String.join(", ", AiBackend.ids())), null);
        }

        Map<String, String> updates = new LinkedHashMap<>();
        if (request.apiKey() != null && !request.apiKey().isBlank()) {
            updates.put(config.getApiKeyEnvVar(backend).name(), request.apiKey().trim());
        }
        if (request.language() != null && !request.language().isBlank()) {
            updates.put(ConfigKey.AI_LANGUAGE.name(), request.language().trim());
        }
        if (request.timeout() != null && request.timeout() > 0) {
            updates.put(ConfigKey.AI_TIMEOUT.name(), request.timeout().toString());
        }
        if (request.maxRetries() != null && request.maxRetries() > 0) {
            updates.put(ConfigKey.AI_MAX_RETRIES.name(), request.maxRetries().toString());
        }

        try {
            Path file = settingsWriter.write(request.scope(), updates);
            config.reload();
            return new ConfigureResponse(true, "AI service %s configured".formatted(backend), file.toString());
        } catch (IOException e) {
            log.error("Could not write settings", e);
            return new ConfigureResponse(false, "Configuration failed: " + e.getMessage(), null);
        }
    }

    /**
     * @param probe also send a short request to every configured backend
     */
    public ServiceStatus getAiServiceStatus(boolean probe) {
        List<ServiceStatus.BackendStatus> services = registry.all().stream()
                .map(backend -> backendStatus(backend, probe))
                .toList();

        return new ServiceStatus(
                config.getPreferredBackend().id(),
                services,
                config.isAutoSwitchEnabled(),
                config.getLanguage(),
                config.getTimeout(),
                config.getMaxRetries(),
                config.getConfigPath(ConfigScope.GLOBAL).file().toString(),
                config.getConfigPath(ConfigScope.PROJECT).file().toString());
    }

    private ServiceStatus.BackendStatus backendStatus(Backend backend, boolean probe) {
        boolean configured = backend.isConfigured();
        Boolean available = probe ? configured && orchestrator.probe(backend.id()) : null;
        return new ServiceStatus.BackendStatus(backend.name(), configured, available,
                config.getApiKeyEnvVar(backend.id()).name());
    }

    private ReviewResponse review(String kind, String promptKey, String content,
                                  String aiService, String customPrompt) {
        AiBackend preferred = preferredBackend(aiService);
        String prompt = prompts.buildPrompt(promptKey, content, customPrompt, config.getLanguage());
        try {
            InvocationResult result = orchestrator.invoke(preferred, prompt);
            log.info("{} completed by {} ({} chars, {} failed attempt(s))", kind, result.usedBackend(),
                    result.text().length(), result.failedAttempts().size());
            return new ReviewResponse(ReviewStatus.SUCCESS, kind + " completed", result.text(),
                    result.usedBackend().id(), clock.instant());
        } catch (AllBackendsFailedException e) {
            log.error("{} failed: {}", kind, e.getMessage());
            return failed(kind, e.getMessage(), aiService);
        }
    }

    private ReviewResponse failed(String kind, String message, String aiService) {
        return new ReviewResponse(ReviewStatus.FAILED, kind + " failed",
                "Review failed: " + message, preferredBackend(aiService).id(), clock.instant());
    }

    private ReviewResponse nothingToReview(String summary, String review, String aiService) {
        return new ReviewResponse(ReviewStatus.NOTHING_TO_REVIEW, summary, review,
                preferredBackend(aiService).id(), clock.instant());
    }

    private AiBackend preferredBackend(String aiService) {
        return aiService != null && !aiService.isBlank()
                ? AiBackend.normalize(aiService)
                : config.getPreferredBackend();
    }

    private Path repositoryPath(String path) {
        if (path == null || path.isBlank()) {
            return config.getProjectDir();
        }
        if (!FileSource.isValidPath(path)) {
            throw new IllegalArgumentException("Invalid repository path: " + path);
        }
        return config.getProjectDir().resolve(path);
    }

    static String fileReviewContent(List<FileContent> contents) {
        StringBuilder sb = new StringBuilder("Files under review:\n\n");
        for (FileContent file : contents) {
            sb.append("## File: ").append(file.path()).append("\n\n");
            if (file.hasError()) {
                sb.append("Error: ").append(file.error()).append("\n\n");
            } else {
                sb.append("```\n").append(file.content()).append("\n```\n\n");
            }
        }
        return sb.toString();
    }
}

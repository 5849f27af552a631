package com.coderocket;

import com.coderocket.config.ConfigScope;
import com.coderocket.model.ConfigureRequest;
import com.coderocket.model.ConfigureResponse;
import com.coderocket.model.ReviewChangesRequest;
import com.coderocket.model.ReviewCodeRequest;
import com.coderocket.model.ReviewCommitRequest;
import com.coderocket.model.ReviewFilesRequest;
import com.coderocket.model.ReviewResponse;
import com.coderocket.model.ReviewStatus;
import com.coderocket.model.ServiceStatus;
import com.coderocket.service.ReviewService;
import com.coderocket.tui.ReviewPrinter;
import com.coderocket.tui.Spinner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

@Command(
        name = "coderocket",
        description = "AI code review for snippets, git changes, commits and files",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        subcommands = {
                CodeRocketCli.ReviewCodeCommand.class,
                CodeRocketCli.ReviewChangesCommand.class,
                CodeRocketCli.ReviewCommitCommand.class,
                CodeRocketCli.ReviewFilesCommand.class,
                CodeRocketCli.ConfigureCommand.class,
                CodeRocketCli.StatusCommand.class,
                CodeRocketCli.SetupCommand.class
        }
)
public class CodeRocketCli implements Callable<Integer> {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    @Option(names = "--json", scope = CommandLine.ScopeType.INHERIT,
            description = "Print responses as JSON")
    boolean json;

    @Spec
    CommandSpec spec;

    private final Supplier<CodeRocketContext> contextFactory;

    public CodeRocketCli() {
        this(CodeRocketContext::create);
    }

    public CodeRocketCli(Supplier<CodeRocketContext> contextFactory) {
        this.contextFactory = contextFactory;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Run one review with the spinner on stderr and print the response.
     */
    int review(String service, Function<ReviewService, ReviewResponse> call) {
        return withContext(context -> {
            String label = service != null ? service : context.config().getPreferredBackend().id();
            ReviewResponse response;
            try (Spinner spinner = new Spinner(err())) {
                if (!json && System.console() != null) {
                    spinner.start(label);
                }
                response = call.apply(context.reviewService());
            }
            print(response);
            return response.status() == ReviewStatus.FAILED ? 1 : 0;
        });
    }

    int withContext(Function<CodeRocketContext, Integer> action) {
        try (CodeRocketContext context = contextFactory.get()) {
            return action.apply(context);
        } catch (Exception e) {
            err().println("\n  \u001b[31mError: " + e.getMessage() + "\u001b[0m\n");
            err().flush();
            return 1;
        }
    }

    void print(Object response) {
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            try {
                out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } catch (IOException e) {
                throw new IllegalStateException("Could not serialize response", e);
            }
            out.flush();
            return;
        }
        ReviewPrinter printer = new ReviewPrinter(out);
        if (response instanceof ReviewResponse review) {
            printer.print(review);
        } else if (response instanceof ConfigureResponse configure) {
            printer.print(configure);
        } else if (response instanceof ServiceStatus status) {
            printer.print(status);
        }
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    @Command(name = "review-code", description = "Review a code snippet (from --code, --file or stdin)")
    static class ReviewCodeCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Option(names = {"-c", "--code"}, description = "Code to review")
        String code;

        @Option(names = {"-f", "--file"}, description = "Read the code from this file")
        Path file;

        @Option(names = {"-l", "--language"}, description = "Programming language of the snippet")
        String language;

        @Option(names = "--context", description = "Extra context about the code")
        String context;

        @Option(names = {"-s", "--service"}, description = "AI service to use (gemini, claudecode)")
        String service;

        @Option(names = "--prompt", description = "Custom prompt; {content} is replaced by the code")
        String customPrompt;

        @Override
        public Integer call() throws IOException {
            String source = code;
            if (source == null && file != null) {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } else if (source == null) {
                source = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (source.isBlank()) {
                parent.err().println("\n  \u001b[33mNo code to review. Pass --code, --file or pipe code on stdin.\u001b[0m\n");
                parent.err().flush();
                return 1;
            }
            ReviewCodeRequest request = new ReviewCodeRequest(source, language, context, service, customPrompt);
            return parent.review(service, reviews -> reviews.reviewCode(request));
        }
    }

    @Command(name = "review-changes", description = "Review the uncommitted changes of a git repository")
    static class ReviewChangesCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Option(names = {"-r", "--repo"}, description = "Repository path (default: current directory)")
        String repositoryPath;

        @Option(names = "--no-staged", description = "Leave out staged changes")
        boolean noStaged;

        @Option(names = "--no-unstaged", description = "Leave out unstaged changes")
        boolean noUnstaged;

        @Option(names = {"-s", "--service"}, description = "AI service to use (gemini, claudecode)")
        String service;

        @Option(names = "--prompt", description = "Custom prompt; {content} is replaced by the diff")
        String customPrompt;

        @Override
        public Integer call() {
            ReviewChangesRequest request = new ReviewChangesRequest(
                    repositoryPath, !noStaged, !noUnstaged, service, customPrompt);
            return parent.review(service, reviews -> reviews.reviewChanges(request));
        }
    }

    @Command(name = "review-commit", description = "Review a single commit (HEAD by default)")
    static class ReviewCommitCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Parameters(arity = "0..1", paramLabel = "HASH", description = "Commit hash")
        String commitHash;

        @Option(names = {"-r", "--repo"}, description = "Repository path (default: current directory)")
        String repositoryPath;

        @Option(names = {"-s", "--service"}, description = "AI service to use (gemini, claudecode)")
        String service;

        @Option(names = "--prompt", description = "Custom prompt; {content} is replaced by the commit")
        String customPrompt;

        @Override
        public Integer call() {
            ReviewCommitRequest request = new ReviewCommitRequest(repositoryPath, commitHash, service, customPrompt);
            return parent.review(service, reviews -> reviews.reviewCommit(request));
        }
    }

    @Command(name = "review-files", description = "Review one or more files")
    static class ReviewFilesCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to review")
        List<String> files;

        @Option(names = {"-r", "--repo"}, description = "Base path the files are relative to")
        String repositoryPath;

        @Option(names = {"-s", "--service"}, description = "AI service to use (gemini, claudecode)")
        String service;

        @Option(names = "--prompt", description = "Custom prompt; {content} is replaced by the files")
        String customPrompt;

        @Override
        public Integer call() {
            ReviewFilesRequest request = new ReviewFilesRequest(files, repositoryPath, service, customPrompt);
            return parent.review(service, reviews -> reviews.reviewFiles(request));
        }
    }

    @Command(name = "configure", description = "Save settings for an AI service")
    static class ConfigureCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Parameters(index = "0", paramLabel = "SERVICE", description = "AI service (gemini, claudecode)")
        String service;

        @Option(names = "--scope", defaultValue = "project",
                description = "Settings file to write: project (./.env) or global (~/.coderocket/env)")
        String scope;

        @Option(names = {"-k", "--api-key"}, description = "API key for the service")
        String apiKey;

        @Option(names = {"-l", "--language"}, description = "Review language, e.g. en or zh-CN")
        String language;

        @Option(names = "--timeout", description = "Timeout per attempt in seconds")
        Integer timeout;

        @Option(names = "--max-retries", description = "Attempts per service")
        Integer maxRetries;

        @Override
        public Integer call() {
            return parent.withContext(context -> {
                ConfigureRequest request = new ConfigureRequest(
                        service, ConfigScope.parse(scope), apiKey, language, timeout, maxRetries);
                ConfigureResponse response = context.reviewService().configureAiService(request);
                parent.print(response);
                return response.success() ? 0 : 1;
            });
        }
    }

    @Command(name = "status", description = "Show the AI service configuration")
    static class StatusCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Option(names = "--probe", description = "Send a short request to every configured service")
        boolean probe;

        @Override
        public Integer call() {
            return parent.withContext(context -> {
                parent.print(context.reviewService().getAiServiceStatus(probe));
                return 0;
            });
        }
    }

    @Command(name = "setup", description = "Interactive setup wizard for an AI service")
    static class SetupCommand implements Callable<Integer> {
        @ParentCommand
        CodeRocketCli parent;

        @Override
        public Integer call() {
            return parent.withContext(context -> {
                try {
                    return new SetupWizard(context).run() ? 0 : 1;
                } catch (IOException e) {
                    throw new IllegalStateException("Setup failed: " + e.getMessage(), e);
                }
            });
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeRocketCli()).execute(args);
        System.exit(exitCode);
    }
}

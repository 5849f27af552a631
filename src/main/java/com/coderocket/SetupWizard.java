package com.coderocket;

import com.coderocket.config.ConfigScope;
import com.coderocket.model.AiBackend;
import com.coderocket.model.ConfigureRequest;
import com.coderocket.model.ConfigureResponse;
import com.coderocket.tui.ReviewPrinter;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;

/**
 * Interactive setup: pick a service and a settings file, enter the API key.
 */
public class SetupWizard {

    private final CodeRocketContext context;

    public SetupWizard(CodeRocketContext context) {
        this.context = context;
    }

    /**
     * @return whether the settings were written
     */
    public boolean run() throws IOException {
        try (Terminal terminal = TerminalBuilder.builder()
                .system(true)
                .build()) {

            PrintWriter out = terminal.writer();
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .build();

            out.println("\n  \u001b[1mcoderocket setup\u001b[0m\n");
            out.flush();

            // Step 1: service
            List<String> services = Arrays.stream(AiBackend.values())
                    .map(b -> b.id() + " (" + b.displayName() + ")")
                    .toList();
            int serviceIndex = selectWithArrows(terminal, services, "  Select the AI service to configure:\n");
            AiBackend backend = AiBackend.values()[serviceIndex];

            // Step 2: settings file
            List<String> scopes = List.of(
                    "project  " + context.config().getConfigPath(ConfigScope.PROJECT).file(),
                    "global   " + context.config().getConfigPath(ConfigScope.GLOBAL).file());
            int scopeIndex = selectWithArrows(terminal, scopes, "\n  Where should the settings be saved?\n");
            ConfigScope scope = scopeIndex == 0 ? ConfigScope.PROJECT : ConfigScope.GLOBAL;

            // Step 3: credentials and language
            String keyVar = context.config().getApiKeyEnvVar(backend).name();
            String apiKey = lineReader.readLine("\u001b[36m  " + keyVar + ": \u001b[0m", '*');
            if (apiKey.isBlank()) {
                out.println("\n  \u001b[33mNo API key entered. Aborting setup.\u001b[0m\n");
                out.flush();
                return false;
            }

            String currentLanguage = context.config().getLanguage();
            String languageAnswer = lineReader.readLine(
                    "\u001b[36m  Review language [" + currentLanguage + "]: \u001b[0m");
            String language = languageAnswer.isBlank() ? null : languageAnswer.trim();

            ConfigureResponse response = context.reviewService().configureAiService(
                    new ConfigureRequest(backend.id(), scope, apiKey, language, null, null));
            new ReviewPrinter(out).print(response);

            if (response.success() && backend != context.config().getPreferredBackend()) {
                out.println("  \u001b[2mSet AI_SERVICE=" + backend.id()
                        + " to make it the default service.\u001b[0m\n");
                out.flush();
            }
            return response.success();
        }
    }

    /**
     * Arrow-key selection menu using JLine terminal raw mode.
     *
     * @return index of the chosen item
     */
    static int selectWithArrows(Terminal terminal, List<String> items, String label) throws IOException {
        PrintWriter out = terminal.writer();
        int selected = 0;

        out.print(label);
        render(out, items, selected, false);

        Terminal.SignalHandler prevHandler = terminal.handle(Terminal.Signal.INT, s -> System.exit(130));

        try {
            terminal.enterRawMode();
            NonBlockingReader reader = terminal.reader();

            while (true) {
                int c = reader.read();

                if (c == 27) { // ESC sequence
                    int c2 = reader.read(50);
                    if (c2 == '[') {
                        int c3 = reader.read(50);
                        if (c3 == 'A') {
                            selected = (selected - 1 + items.size()) % items.size();
                        } else if (c3 == 'B') {
                            selected = (selected + 1) % items.size();
                        }
                    }
                } else if (c == 'k') {
                    selected = (selected - 1 + items.size()) % items.size();
                } else if (c == 'j') {
                    selected = (selected + 1) % items.size();
                } else if (c == '\r' || c == '\n') {
                    out.println();
                    out.flush();
                    return selected;
                } else if (c == 3) { // Ctrl+C
                    System.exit(130);
                }

                render(out, items, selected, true);
            }
        } finally {
            terminal.handle(Terminal.Signal.INT, prevHandler);
        }
    }

    private static void render(PrintWriter out, List<String> items, int selected, boolean redraw) {
        if (redraw) {
            out.print("\u001b[" + items.size() + "A");
        }
        for (int i = 0; i < items.size(); i++) {
            String cursor = i == selected ? "\u001b[36m>\u001b[0m" : " ";
            String text = i == selected
                    ? "\u001b[36m" + items.get(i) + "\u001b[0m"
                    : "\u001b[2m" + items.get(i) + "\u001b[0m";
            out.println("\u001b[2K    " + cursor + " " + text);
        }
        out.flush();
    }
}

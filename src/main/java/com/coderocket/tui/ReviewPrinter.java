package com.coderocket.tui;

import com.coderocket.model.ConfigureResponse;
import com.coderocket.model.ReviewResponse;
import com.coderocket.model.ReviewStatus;
import com.coderocket.model.ServiceStatus;

import java.io.PrintWriter;

/**
 * Human-readable rendering of service responses.
 */
public class ReviewPrinter {

    private final PrintWriter out;

    public ReviewPrinter(PrintWriter out) {
        this.out = out;
    }

    public void print(ReviewResponse response) {
        String color = switch (response.status()) {
            case SUCCESS -> "\u001b[32m";
            case WARNING, NOTHING_TO_REVIEW -> "\u001b[33m";
            case FAILED -> "\u001b[31m";
        };
        out.println();
        out.println("  " + color + response.status().symbol() + " " + response.summary() + "\u001b[0m");
        if (response.status() == ReviewStatus.SUCCESS) {
            out.println("  \u001b[2mReviewed by " + response.aiServiceUsed() + " at " + response.timestamp() + "\u001b[0m");
        }
        out.println();
        out.println(response.review());
        out.println();
        out.flush();
    }

    public void print(ConfigureResponse response) {
        out.println();
        if (response.success()) {
            out.println("  \u001b[32m" + response.message() + "\u001b[0m");
            out.println("  \u001b[2mWrote " + response.configPath() + "\u001b[0m");
        } else {
            out.println("  \u001b[31m" + response.message() + "\u001b[0m");
        }
        out.println();
        out.flush();
    }

    public void print(ServiceStatus status) {
        out.println();
        out.println("  \u001b[1mAI services\u001b[0m");
        out.println();
        for (ServiceStatus.BackendStatus service : status.services()) {
            String marker = service.service().equals(status.currentService()) ? "\u001b[36m>\u001b[0m" : " ";
            String state = service.configured()
                    ? "\u001b[32mconfigured\u001b[0m"
                    : "\u001b[2mnot configured (set " + service.apiKeyVariable() + ")\u001b[0m";
            if (service.available() != null) {
                state += service.available() ? "  \u001b[32mreachable\u001b[0m" : "  \u001b[31munreachable\u001b[0m";
            }
            out.println("    " + marker + " " + "%-12s".formatted(service.service()) + state);
        }
        out.println();
        out.println("  \u001b[2mAuto-switch:  " + (status.autoSwitchEnabled() ? "on" : "off") + "\u001b[0m");
        out.println("  \u001b[2mLanguage:     " + status.language() + "\u001b[0m");
        out.println("  \u001b[2mTimeout:      " + status.timeout() + "s\u001b[0m");
        out.println("  \u001b[2mMax retries:  " + status.maxRetries() + "\u001b[0m");
        out.println("  \u001b[2mGlobal file:  " + status.globalConfigPath() + "\u001b[0m");
        out.println("  \u001b[2mProject file: " + status.projectConfigPath() + "\u001b[0m");
        out.println();
        out.flush();
    }
}

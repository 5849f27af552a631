package com.coderocket.tui;

import java.io.PrintWriter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Animated spinner shown on stderr while a backend call is in flight.
 */
public class Spinner implements AutoCloseable {

    private static final String[] FRAMES = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};

    private static final String[] WORDINGS = {
            "Reviewing",
            "Reading the diff",
            "Inspecting",
            "Analyzing",
            "Examining",
            "Scrutinizing",
            "Weighing",
            "Checking",
    };

    private final PrintWriter out;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread thread;

    public Spinner(PrintWriter out) {
        this.out = out;
    }

    /**
     * Start with a random wording, e.g. "Analyzing with gemini...".
     */
    public void start(String service) {
        String wording = WORDINGS[ThreadLocalRandom.current().nextInt(WORDINGS.length)];
        start(wording, service);
    }

    void start(String wording, String service) {
        if (running.getAndSet(true)) return;
        String label = wording + " with " + service;

        thread = new Thread(() -> {
            int frame = 0;
            boolean blink = true;
            try {
                while (running.get()) {
                    String style = blink ? "\u001b[1;35m" : "\u001b[2;35m";
                    out.print("\r  " + style + FRAMES[frame % FRAMES.length] + " " + label + "...\u001b[0m\u001b[K");
                    out.flush();

                    frame++;
                    if (frame % 3 == 0) blink = !blink;
                    Thread.sleep(80);
                }
            } catch (InterruptedException e) {
                // stop() interrupts the sleep
                Thread.currentThread().interrupt();
            } finally {
                out.print("\r\u001b[K");
                out.flush();
            }
        }, "coderocket-spinner");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        if (!running.getAndSet(false)) return;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        stop();
    }
}

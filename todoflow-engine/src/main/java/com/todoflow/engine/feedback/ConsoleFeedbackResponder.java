package com.todoflow.engine.feedback;

import com.todoflow.core.model.FeedbackRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Responder that prints the request and reads one line from a terminal.
 *
 * Lines are read by a single long-lived daemon thread into a queue, so a request that
 * timed out never leaves a second reader behind on the same input. A line typed after
 * a timeout answers the next request.
 */
public class ConsoleFeedbackResponder implements FeedbackResponder {

    private static final Logger log = LoggerFactory.getLogger(ConsoleFeedbackResponder.class);

    // Marks end of input; put back after every take so later requests see it too
    private static final Optional<String> END_OF_INPUT = Optional.empty();

    private final BufferedReader in;
    private final PrintStream out;
    private final BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
    private Thread reader;

    public ConsoleFeedbackResponder() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleFeedbackResponder(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String respond(FeedbackRequest request) throws IOException {
        ensureReader();

        out.println();
        out.println("[" + request.getKind() + "] " + request.getMessage());
        if (!request.getOptions().isEmpty()) {
            out.println("Options: " + String.join(", ", request.getOptions()));
        }
        request.getDefaultResponse().ifPresent(d -> out.println("Default: " + d));
        request.getTimeout().ifPresent(t -> out.println("Timeout: " + t.toMillis() + "ms"));
        out.print("> ");
        out.flush();

        Optional<String> line;
        try {
            line = lines.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for input");
        }
        if (line.isEmpty()) {
            lines.add(END_OF_INPUT);
            throw new IOException("Input closed");
        }
        return line.get().strip();
    }

    private synchronized void ensureReader() {
        if (reader != null) {
            return;
        }
        reader = new Thread(this::readLines, "console-feedback-reader");
        reader.setDaemon(true);
        reader.start();
    }

    private void readLines() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lines.add(Optional.of(line));
            }
        } catch (IOException e) {
            log.warn("Console input failed: {}", e.getMessage());
        }
        lines.add(END_OF_INPUT);
    }
}

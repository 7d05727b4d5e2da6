package com.todoflow.engine.feedback;

import com.todoflow.core.model.FeedbackRequest;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Responder answering from a script, for demos and tests.
 * Once a queued script runs dry every further request gets a blank answer, i.e. its default.
 */
public class ScriptedFeedbackResponder implements FeedbackResponder {

    private final Function<FeedbackRequest, String> script;
    private final List<FeedbackRequest> received = new CopyOnWriteArrayList<>();

    public ScriptedFeedbackResponder(Function<FeedbackRequest, String> script) {
        this.script = script;
    }

    /**
     * Answer requests with the given responses, in order.
     */
    public static ScriptedFeedbackResponder of(String... responses) {
        Deque<String> queue = new ArrayDeque<>(Arrays.asList(responses));
        return new ScriptedFeedbackResponder(request -> {
            synchronized (queue) {
                return queue.isEmpty() ? "" : queue.poll();
            }
        });
    }

    @Override
    public String respond(FeedbackRequest request) {
        received.add(request);
        return script.apply(request);
    }

    /**
     * Requests seen so far, in arrival order.
     */
    public List<FeedbackRequest> received() {
        return List.copyOf(received);
    }
}

package com.todoflow.engine.feedback;

import com.todoflow.core.model.FeedbackRequest;

import java.io.IOException;

/**
 * Source of answers to feedback requests: a person at a terminal, a script, a remote UI.
 * The gateway bounds every call by the request timeout.
 */
@FunctionalInterface
public interface FeedbackResponder {

    /**
     * Answer a request. A blank answer means "use the default".
     *
     * @param request The request to answer
     * @return The raw response text
     * @throws IOException if the response channel failed
     */
    String respond(FeedbackRequest request) throws IOException;
}

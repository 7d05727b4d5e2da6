package com.todoflow.core.model;

/**
 * How a feedback request was resolved.
 */
public enum FeedbackResolution {
    /** A responder answered in time. */
    ANSWERED,
    /** Non-interactive mode answered from defaults. */
    DEFAULTED,
    /** The responder did not answer before the timeout; defaults were used. */
    TIMED_OUT,
    /** The responder failed; defaults were used. */
    RESPONDER_ERROR
}

package com.todoflow.core.model;

/**
 * Where the initial todos of a session came from.
 */
public enum PlanSource {
    /** Derived from the reasoning collaborator's steps. */
    REASONING,
    /** Deterministic template set used when the collaborator failed or returned nothing. */
    FALLBACK
}

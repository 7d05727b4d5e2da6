package com.todoflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of the execution-history log: what ran in which iteration and how it ended.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionRecord(
    int iteration,
    String todoId,
    String todoContent,
    ExecutionResult result,
    ValidationDecision validation,
    Instant timestamp
) {}

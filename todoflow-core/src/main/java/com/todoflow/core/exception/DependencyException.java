package com.todoflow.core.exception;

import java.util.Collection;

/**
 * Thrown when a todo references dependencies the store does not know.
 */
public class DependencyException extends TodoflowException {
    
    public static final String ERROR_CODE = "INVALID_DEPENDENCY";
    
    public DependencyException(String message) {
        super(ERROR_CODE, message);
    }
    
    public DependencyException(Collection<String> unknownIds) {
        super(ERROR_CODE, String.format(
            "Todo references unknown dependencies: %s",
            unknownIds
        ));
    }
}

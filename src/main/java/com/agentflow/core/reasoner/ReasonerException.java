package com.agentflow.core.reasoner;

/**
 * Thrown by a {@link Reasoner} that cannot produce an outcome.
 */
public class ReasonerException extends RuntimeException {

    public ReasonerException(String message) {
        super(message);
    }

    public ReasonerException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.agentflow.core.store;

/**
 * Thrown when the backing store cannot complete an operation (I/O, SQL or
 * serialization failure). Sweeps catch it at their boundary and back off.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.lexis.store;

import java.io.IOException;

/**
 * Thrown when a persisted index cannot be decoded or is internally inconsistent.
 */
public class InvalidIndexException extends IOException {
    
    public InvalidIndexException(String message) {
        super(message);
    }
    
    public InvalidIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.lexis;

/**
 * Thrown when an operation needs a loaded or built index but the indexer was never initialized.
 */
public class IndexNotInitializedException extends IllegalStateException {
    
    public IndexNotInitializedException(String operation) {
        super(String.format(
            "Cannot %s: index not initialized. Call initialize() or rebuild() first.", operation));
    }
}

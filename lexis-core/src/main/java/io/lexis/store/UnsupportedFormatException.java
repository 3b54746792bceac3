package io.lexis.store;

/**
 * Exception thrown when trying to load an unsupported format version.
 */
public class UnsupportedFormatException extends InvalidIndexException {
    
    private final String version;
    
    public UnsupportedFormatException(String version) {
        super(String.format("Unsupported index format version: %s (expected %s)",
            version, CorpusIndex.FORMAT_VERSION));
        this.version = version;
    }
    
    public String getVersion() {
        return version;
    }
}

package io.lexis.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Opaque store for the encoded index.
 */
public interface IndexStorage {
    
    /**
     * Reads the stored index.
     * 
     * @return the encoded index, or empty when nothing has been saved yet
     */
    Optional<byte[]> read() throws IOException;
    
    /**
     * Replaces the stored index.
     */
    void write(byte[] data) throws IOException;
    
    /**
     * Human-readable location, for log messages.
     */
    String describe();
}

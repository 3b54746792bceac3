package io.lexis.store;

import java.util.Optional;

/**
 * Keeps the encoded index in memory. Useful for tests and throwaway indexes.
 */
public class InMemoryIndexStorage implements IndexStorage {
    
    private volatile byte[] data;
    private volatile int writes;
    
    @Override
    public Optional<byte[]> read() {
        byte[] current = data;
        return current != null ? Optional.of(current.clone()) : Optional.empty();
    }
    
    @Override
    public synchronized void write(byte[] data) {
        this.data = data.clone();
        this.writes++;
    }
    
    @Override
    public String describe() {
        return "memory";
    }
    
    /**
     * Number of writes so far.
     */
    public int getWriteCount() {
        return writes;
    }
}

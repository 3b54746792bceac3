package io.lexis;

/**
 * Summary of an incremental synchronization against the corpus on disk.
 */
public record SyncReport(int added, int updated, int unchanged, int removed) {
    
    /**
     * Whether the synchronization modified the index.
     */
    public boolean changed() {
        return added + updated + removed > 0;
    }
}

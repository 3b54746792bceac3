package io.lexis;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about a corpus index.
 */
public record IndexStats(
    /** Number of indexed documents */
    int documentCount,
    
    /** Number of terms admitted to the vocabulary */
    int vocabularySize,
    
    /** Vector dimensions */
    int dimensions,
    
    /** Documents per topical tag */
    Map<String, Integer> documentsByTag,
    
    /** When the index was first created */
    Instant created,
    
    /** Last mutation of the index */
    Instant lastUpdated
) {}

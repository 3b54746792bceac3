package io.lexis;

import java.time.Duration;

/**
 * Summary of a full rebuild.
 */
public record RebuildReport(
    /** Files enumerated by the corpus walker */
    int filesFound,
    
    /** Files turned into documents */
    int documentsIndexed,
    
    /** Files skipped (unreadable, oversized or without usable tokens) */
    int filesSkipped,
    
    /** Terms admitted to the new vocabulary */
    int vocabularySize,
    
    /** Wall-clock time of the rebuild */
    Duration duration
) {}

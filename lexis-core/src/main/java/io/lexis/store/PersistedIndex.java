package io.lexis.store;

import io.lexis.DocumentRecord;

import java.util.Map;

/**
 * JSON shape of a saved index.
 */
public record PersistedIndex(
    String version,
    long created,
    long updated,
    int documentCount,
    int dimension,
    Map<String, Integer> vocabulary,
    Map<String, Double> idfScores,
    Map<String, DocumentRecord> documents,
    boolean built
) {}

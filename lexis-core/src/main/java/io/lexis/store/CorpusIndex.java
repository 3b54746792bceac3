package io.lexis.store;

import io.lexis.DocumentRecord;
import io.lexis.IndexStats;
import io.lexis.embeddings.Vocabulary;

import java.time.Instant;
import java.util.*;

/**
 * The index aggregate: one vocabulary and the documents encoded against it.
 * 
 * <p>Documents are kept in insertion order, which is also the order the
 * ranker visits them in. Every embedding has exactly
 * {@code vocabulary().dimensions()} components.</p>
 * 
 * <p>Not thread-safe; {@link io.lexis.CorpusIndexer} serializes access.</p>
 */
public class CorpusIndex {
    
    public static final String FORMAT_VERSION = "1.0";
    
    private Vocabulary vocabulary;
    private final Map<String, DocumentRecord> documents;
    private final long created;
    private long updated;
    private boolean built;
    
    private CorpusIndex(Vocabulary vocabulary, Map<String, DocumentRecord> documents,
                        long created, long updated, boolean built) {
        this.vocabulary = vocabulary;
        this.documents = documents;
        this.created = created;
        this.updated = updated;
        this.built = built;
    }
    
    /**
     * Creates an index with no vocabulary and no documents.
     */
    public static CorpusIndex empty(int dimensions) {
        long now = System.currentTimeMillis();
        return new CorpusIndex(Vocabulary.empty(dimensions), new LinkedHashMap<>(), now, now, false);
    }
    
    /**
     * Recreates a previously persisted index.
     * 
     * <p>An index holding a vocabulary or any document counts as built even
     * when {@code built} is false.</p>
     * 
     * @throws IllegalArgumentException if a document is stored under another id
     *         or its embedding does not match the vocabulary's dimensions
     */
    public static CorpusIndex restore(Vocabulary vocabulary, Map<String, DocumentRecord> documents,
                                      long created, long updated, boolean built) {
        Objects.requireNonNull(vocabulary, "vocabulary cannot be null");
        boolean populated = built || !vocabulary.isEmpty() || !documents.isEmpty();
        CorpusIndex index = new CorpusIndex(vocabulary, new LinkedHashMap<>(), created, updated, populated);
        for (Map.Entry<String, DocumentRecord> entry : documents.entrySet()) {
            DocumentRecord record = entry.getValue();
            if (record == null || !entry.getKey().equals(record.id())) {
                throw new IllegalArgumentException("Document stored under id " + entry.getKey()
                    + " has id " + (record != null ? record.id() : null));
            }
            index.checkDimensions(record);
            index.documents.put(record.id(), record);
        }
        return index;
    }
    
    // ==================== Mutation ====================
    
    /**
     * Replaces vocabulary and documents together, as a full rebuild does.
     * The index counts as built afterwards unless both are empty.
     */
    public void replaceAll(Vocabulary vocabulary, List<DocumentRecord> records) {
        Objects.requireNonNull(vocabulary, "vocabulary cannot be null");
        Map<String, DocumentRecord> replacement = new LinkedHashMap<>();
        for (DocumentRecord record : records) {
            if (record.embedding().length != vocabulary.dimensions()) {
                throw new IllegalArgumentException(dimensionMismatch(record, vocabulary.dimensions()));
            }
            replacement.put(record.id(), record);
        }
        this.vocabulary = vocabulary;
        this.built = !vocabulary.isEmpty() || !replacement.isEmpty();
        documents.clear();
        documents.putAll(replacement);
        touch();
    }
    
    /**
     * Inserts or replaces a document. A replaced document keeps its position.
     */
    public void put(DocumentRecord record) {
        checkDimensions(record);
        documents.put(record.id(), record);
        touch();
    }
    
    /**
     * Removes a document by id.
     * 
     * @return true if a document was removed
     */
    public boolean remove(String id) {
        boolean removed = documents.remove(id) != null;
        if (removed) {
            touch();
        }
        return removed;
    }
    
    /**
     * Installs a vocabulary on an index that was never built.
     * 
     * @throws IllegalStateException if the index was already built or bootstrapped,
     *         even when that left the vocabulary empty
     */
    public void adoptVocabulary(Vocabulary bootstrap) {
        if (built) {
            throw new IllegalStateException("Index already has a vocabulary of " + vocabulary.size() + " terms");
        }
        if (bootstrap.dimensions() != vocabulary.dimensions()) {
            throw new IllegalArgumentException(String.format(
                "Vocabulary dimensions %d do not match index dimensions %d",
                bootstrap.dimensions(), vocabulary.dimensions()));
        }
        this.vocabulary = bootstrap;
        this.built = true;
        touch();
    }
    
    private void touch() {
        updated = Math.max(updated, System.currentTimeMillis());
    }
    
    private void checkDimensions(DocumentRecord record) {
        if (record.embedding().length != vocabulary.dimensions()) {
            throw new IllegalArgumentException(dimensionMismatch(record, vocabulary.dimensions()));
        }
    }
    
    private static String dimensionMismatch(DocumentRecord record, int dimensions) {
        return String.format("Embedding dimension mismatch for %s: expected %d, got %d",
            record.relativePath(), dimensions, record.embedding().length);
    }
    
    // ==================== Access ====================
    
    public Optional<DocumentRecord> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }
    
    /**
     * Documents in insertion order (unmodifiable view).
     */
    public Collection<DocumentRecord> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }
    
    public int documentCount() {
        return documents.size();
    }
    
    public Vocabulary vocabulary() {
        return vocabulary;
    }
    
    /**
     * Whether the vocabulary is fixed, by a rebuild that indexed something or
     * by a bootstrap. Only an unbuilt index may adopt a bootstrap vocabulary.
     */
    public boolean isBuilt() {
        return built;
    }
    
    public int dimensions() {
        return vocabulary.dimensions();
    }
    
    public long created() {
        return created;
    }
    
    public long updated() {
        return updated;
    }
    
    public IndexStats stats() {
        Map<String, Integer> byTag = new TreeMap<>();
        for (DocumentRecord record : documents.values()) {
            byTag.merge(record.topicalTag(), 1, Integer::sum);
        }
        return new IndexStats(
            documents.size(),
            vocabulary.size(),
            vocabulary.dimensions(),
            byTag,
            Instant.ofEpochMilli(created),
            Instant.ofEpochMilli(updated)
        );
    }
}

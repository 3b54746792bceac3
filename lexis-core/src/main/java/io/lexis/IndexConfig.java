package io.lexis;

import io.lexis.embeddings.EmbeddingConfig;

import java.util.Objects;

/**
 * Configuration for encoding documents and ranking queries.
 */
public record IndexConfig(
    /** Tokenizer and vocabulary settings */
    EmbeddingConfig embedding,
    
    /** Characters of each file kept for exact-match highlighting */
    int previewLength,
    
    /** Maximum summary length */
    int summaryLength,
    
    /** Leading lines used as summary when the file has no doc comment */
    int summaryLines,
    
    /** Score added when the document tag contains the requested tag */
    double topicalBoost,
    
    /** Score added when the query occurs literally in the preview */
    double exactMatchBoost,
    
    /** Maximum highlights per result */
    int maxHighlights,
    
    /** Characters of context on each side of a highlight */
    int highlightContext,
    
    /** Threads reading and tokenizing files during a rebuild */
    int workerThreads
) {
    
    public IndexConfig {
        Objects.requireNonNull(embedding, "embedding cannot be null");
        if (previewLength < 0 || summaryLength < 0 || summaryLines < 1) {
            throw new IllegalArgumentException("Invalid preview or summary bounds");
        }
        if (maxHighlights < 0 || highlightContext < 0) {
            throw new IllegalArgumentException("Invalid highlight bounds");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
    }
    
    public static IndexConfig defaultConfig() {
        return new IndexConfig(
            EmbeddingConfig.defaults(),
            5000,
            200,
            5,
            0.2,
            0.3,
            3,
            30,
            Math.max(1, Runtime.getRuntime().availableProcessors())
        );
    }
    
    public IndexConfig withEmbedding(EmbeddingConfig embedding) {
        return new IndexConfig(embedding, previewLength, summaryLength, summaryLines,
            topicalBoost, exactMatchBoost, maxHighlights, highlightContext, workerThreads);
    }
    
    public IndexConfig withWorkerThreads(int workerThreads) {
        return new IndexConfig(embedding, previewLength, summaryLength, summaryLines,
            topicalBoost, exactMatchBoost, maxHighlights, highlightContext, workerThreads);
    }
    
    public IndexConfig withPreviewLength(int previewLength) {
        return new IndexConfig(embedding, previewLength, summaryLength, summaryLines,
            topicalBoost, exactMatchBoost, maxHighlights, highlightContext, workerThreads);
    }
}

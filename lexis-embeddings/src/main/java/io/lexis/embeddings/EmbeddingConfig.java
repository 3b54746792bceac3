package io.lexis.embeddings;

import java.util.Set;

/**
 * Configuration for tokenization and TF-IDF vocabulary construction.
 */
public record EmbeddingConfig(
    /** Vector dimensions, the cap on vocabulary size */
    int dimensions,
    
    /** Minimum corpus-wide occurrences for a term to enter the vocabulary */
    int minTermFrequency,
    
    /** Shortest token kept by the tokenizer */
    int minTokenLength,
    
    /** Longest token kept by the tokenizer */
    int maxTokenLength,
    
    /** Additional script whose letters are kept besides ASCII (null = ASCII only) */
    Character.UnicodeScript extraScript,
    
    /** Terms dropped by the tokenizer */
    Set<String> stopWords
) {
    
    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
        "the", "is", "at", "which", "on", "a", "an", "and", "or", "but",
        "in", "to", "for", "of", "with", "as", "by", "from", "that", "this",
        "it", "be", "are", "was", "were", "been", "being", "have", "has",
        "had", "do", "does", "did", "will", "would", "could", "should",
        "may", "might", "must", "shall", "can", "need", "if", "then",
        "import", "export", "const", "let", "var", "function", "class",
        "return", "new", "null", "undefined", "true", "false", "void"
    );
    
    public EmbeddingConfig {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got " + dimensions);
        }
        if (minTermFrequency < 1) {
            throw new IllegalArgumentException("minTermFrequency must be >= 1, got " + minTermFrequency);
        }
        if (minTokenLength < 1 || maxTokenLength < minTokenLength) {
            throw new IllegalArgumentException(String.format(
                "Invalid token length bounds: [%d, %d]", minTokenLength, maxTokenLength));
        }
        stopWords = stopWords != null ? Set.copyOf(stopWords) : Set.of();
    }
    
    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(
            512,
            2,
            2,
            30,
            Character.UnicodeScript.CYRILLIC,
            DEFAULT_STOP_WORDS
        );
    }
    
    public EmbeddingConfig withDimensions(int dimensions) {
        return new EmbeddingConfig(dimensions, minTermFrequency, minTokenLength, maxTokenLength, extraScript, stopWords);
    }
    
    public EmbeddingConfig withMinTermFrequency(int minTermFrequency) {
        return new EmbeddingConfig(dimensions, minTermFrequency, minTokenLength, maxTokenLength, extraScript, stopWords);
    }
    
    public EmbeddingConfig withStopWords(Set<String> stopWords) {
        return new EmbeddingConfig(dimensions, minTermFrequency, minTokenLength, maxTokenLength, extraScript, stopWords);
    }
}

package io.lexis;

import java.util.List;
import java.util.Objects;

/**
 * A ranked document returned by a query.
 */
public record SearchResult(
    /** The matching document */
    DocumentRecord document,
    
    /** Cosine similarity plus any topical and exact-match boosts */
    double score,
    
    /** Context windows around literal occurrences of the query (at most a few) */
    List<String> highlights
) implements Comparable<SearchResult> {
    
    public SearchResult {
        Objects.requireNonNull(document, "document cannot be null");
        highlights = highlights != null ? List.copyOf(highlights) : List.of();
    }
    
    /**
     * Compares by score (descending order).
     */
    @Override
    public int compareTo(SearchResult other) {
        return Double.compare(other.score, this.score);
    }
    
    @Override
    public String toString() {
        return String.format("[%.3f] %s", score, document.relativePath());
    }
}

package io.lexis;

/**
 * Options for a single query.
 */
public record SearchOptions(
    /** Maximum number of results */
    int limit,
    
    /** Tag whose documents receive the topical boost (null = no boost) */
    String topicalTag,
    
    /** Results scoring below this are dropped */
    double minScore
) {
    
    public SearchOptions {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        if (Double.isNaN(minScore)) {
            throw new IllegalArgumentException("minScore must be a number");
        }
        if (topicalTag != null && topicalTag.isBlank()) {
            topicalTag = null;
        }
    }
    
    public static SearchOptions defaults() {
        return new SearchOptions(10, null, 0.1);
    }
    
    public SearchOptions withLimit(int limit) {
        return new SearchOptions(limit, topicalTag, minScore);
    }
    
    public SearchOptions withTopicalTag(String topicalTag) {
        return new SearchOptions(limit, topicalTag, minScore);
    }
    
    public SearchOptions withMinScore(double minScore) {
        return new SearchOptions(limit, topicalTag, minScore);
    }
}

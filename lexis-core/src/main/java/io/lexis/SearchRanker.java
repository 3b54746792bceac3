package io.lexis;

import io.lexis.embeddings.TfIdfEncoder;
import io.lexis.embeddings.Tokenizer;
import io.lexis.store.CorpusIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores every document of an index against a query.
 * 
 * <p>The score is the dot product of the normalized query and document
 * vectors, plus a topical boost when the document's tag contains the
 * requested tag, plus an exact-match boost when the query occurs literally
 * (ignoring case) in the document preview.</p>
 */
public class SearchRanker {
    
    private final IndexConfig config;
    private final Tokenizer tokenizer;
    
    public SearchRanker(IndexConfig config, Tokenizer tokenizer) {
        this.config = config;
        this.tokenizer = tokenizer;
    }
    
    /**
     * Ranks the index's documents.
     * 
     * @return at most {@code options.limit()} results scoring at least
     *         {@code options.minScore()}, best first; equal scores keep index order
     */
    public List<SearchResult> search(CorpusIndex index, String query, SearchOptions options) {
        String text = query != null ? query : "";
        float[] queryVector = new TfIdfEncoder(index.vocabulary(), tokenizer).embed(text);
        
        List<SearchResult> results = new ArrayList<>();
        for (DocumentRecord document : index.documents()) {
            double score = document.similarity(queryVector);
            
            if (options.topicalTag() != null && document.topicalTag().contains(options.topicalTag())) {
                score += config.topicalBoost();
            }
            
            List<String> highlights = List.of();
            if (!text.isBlank() && indexOfIgnoreCase(document.contentPreview(), text, 0) >= 0) {
                score += config.exactMatchBoost();
                highlights = highlights(document.contentPreview(), text);
            }
            
            if (score >= options.minScore()) {
                results.add(new SearchResult(document, score, highlights));
            }
        }
        
        // List.sort is stable
        results.sort(null);
        return results.size() > options.limit()
            ? List.copyOf(results.subList(0, options.limit()))
            : List.copyOf(results);
    }
    
    /**
     * Snippets around the first occurrences of the query in the content.
     */
    List<String> highlights(String content, String query) {
        int context = config.highlightContext();
        
        List<String> highlights = new ArrayList<>();
        int found = indexOfIgnoreCase(content, query, 0);
        while (found >= 0 && highlights.size() < config.maxHighlights()) {
            int start = Math.max(0, found - context);
            int end = Math.min(content.length(), found + query.length() + context);
            highlights.add("..." + content.substring(start, end) + "...");
            found = indexOfIgnoreCase(content, query, found + 1);
        }
        return highlights;
    }
    
    /**
     * Case-insensitive search on the original string; offsets are valid for {@code content}.
     */
    private static int indexOfIgnoreCase(String content, String query, int from) {
        for (int i = from; i + query.length() <= content.length(); i++) {
            if (content.regionMatches(true, i, query, 0, query.length())) {
                return i;
            }
        }
        return -1;
    }
}

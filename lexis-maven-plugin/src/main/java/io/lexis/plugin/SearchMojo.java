package io.lexis.plugin;

import io.lexis.CorpusIndexer;
import io.lexis.DocumentRecord;
import io.lexis.SearchOptions;
import io.lexis.SearchResult;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.*;

import java.io.IOException;
import java.util.List;

/**
 * Searches the lexical index.
 * 
 * <p>Loads the index written by {@code lexis:rebuild}, building it first
 * when it is missing or unreadable.</p>
 * 
 * <p>Usage: {@code mvn lexis:search -Dlexis.query="rate limiter"}</p>
 */
@Mojo(
    name = "search",
    requiresProject = true
)
public class SearchMojo extends AbstractLexisMojo {
    
    /**
     * The search query.
     */
    @Parameter(property = "lexis.query", required = true)
    private String query;
    
    /**
     * Number of results to return.
     */
    @Parameter(property = "lexis.limit", defaultValue = "10")
    private int limit;
    
    /**
     * Boost documents whose topical tag contains this value.
     */
    @Parameter(property = "lexis.tag")
    private String tag;
    
    /**
     * Results scoring below this are dropped.
     */
    @Parameter(property = "lexis.minScore", defaultValue = "0.1")
    private double minScore;
    
    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        getLog().info("Searching for: " + query);
        
        SearchOptions options;
        try {
            options = new SearchOptions(limit, tag, minScore);
        } catch (IllegalArgumentException e) {
            throw new MojoFailureException("Invalid search options: " + e.getMessage(), e);
        }
        
        try (CorpusIndexer indexer = openIndexer()) {
            indexer.initialize();
            List<SearchResult> results = indexer.search(query, options);
            
            getLog().info("");
            getLog().info("Found " + results.size() + " results:");
            getLog().info("=".repeat(60));
            
            int rank = 1;
            for (SearchResult result : results) {
                DocumentRecord document = result.document();
                getLog().info(String.format("#%d [%.3f] %s (%s)",
                    rank++, result.score(), document.relativePath(), document.topicalTag()));
                if (!result.highlights().isEmpty()) {
                    getLog().info("    " + result.highlights().get(0).replace('\n', ' '));
                }
            }
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to search lexis index", e);
        }
    }
}

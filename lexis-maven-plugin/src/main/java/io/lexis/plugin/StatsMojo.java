package io.lexis.plugin;

import io.lexis.CorpusIndexer;
import io.lexis.IndexStats;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.*;

import java.io.IOException;

/**
 * Displays statistics about the lexical index.
 * 
 * <p>Usage: {@code mvn lexis:stats}</p>
 */
@Mojo(
    name = "stats",
    requiresProject = true
)
public class StatsMojo extends AbstractLexisMojo {
    
    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (!indexFile.exists()) {
            throw new MojoExecutionException(
                "Lexis index not found at " + indexFile + ". Run 'mvn lexis:rebuild' first.");
        }
        
        getLog().info("Loading index from: " + indexFile);
        
        try (CorpusIndexer indexer = openIndexer()) {
            if (!indexer.initialize()) {
                getLog().warn("Stored index was unusable and has been rebuilt");
            }
            IndexStats stats = indexer.getStats();
            
            getLog().info("");
            getLog().info("Lexis Index Statistics");
            getLog().info("=".repeat(40));
            getLog().info("Documents: " + stats.documentCount());
            getLog().info("Vocabulary: " + stats.vocabularySize() + " terms");
            getLog().info("Dimensions: " + stats.dimensions());
            getLog().info("Created: " + stats.created());
            getLog().info("Last updated: " + stats.lastUpdated());
            getLog().info("");
            getLog().info("Documents by tag:");
            stats.documentsByTag().forEach((tag, count) ->
                getLog().info("  " + tag + ": " + count));
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to read index stats", e);
        }
    }
}

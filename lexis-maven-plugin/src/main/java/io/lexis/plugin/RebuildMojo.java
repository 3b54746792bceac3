package io.lexis.plugin;

import io.lexis.CorpusIndexer;
import io.lexis.IndexStats;
import io.lexis.RebuildReport;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.*;
import org.apache.maven.project.MavenProjectHelper;

import java.io.IOException;

/**
 * Builds the lexical index over the project's sources.
 * 
 * <p>Usage: {@code mvn lexis:rebuild}</p>
 */
@Mojo(
    name = "rebuild",
    defaultPhase = LifecyclePhase.PACKAGE,
    threadSafe = true
)
public class RebuildMojo extends AbstractLexisMojo {
    
    @Component
    private MavenProjectHelper projectHelper;
    
    /**
     * Whether to attach the index as a Maven artifact.
     */
    @Parameter(property = "lexis.attach", defaultValue = "false")
    private boolean attachArtifact;
    
    /**
     * Skip index generation.
     */
    @Parameter(property = "lexis.skip", defaultValue = "false")
    private boolean skip;
    
    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Skipping lexis index");
            return;
        }
        
        getLog().info("Indexing " + project.getArtifactId());
        
        try (CorpusIndexer indexer = openIndexer()) {
            RebuildReport report = indexer.rebuild();
            IndexStats stats = indexer.getStats();
            
            getLog().info("Indexed " + report.documentsIndexed() + " of " + report.filesFound()
                + " files (" + report.filesSkipped() + " skipped)");
            getLog().info("  Vocabulary: " + stats.vocabularySize() + " terms");
            getLog().info("  Dimensions: " + stats.dimensions());
            getLog().info("  Took: " + report.duration().toMillis() + " ms");
            getLog().info("Saved index to: " + indexFile);
            
            if (attachArtifact) {
                projectHelper.attachArtifact(project, "json", "lexis", indexFile);
                getLog().info("Attached index as Maven artifact");
            }
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to build lexis index", e);
        }
    }
}

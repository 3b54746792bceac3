package io.lexis.plugin;

import io.lexis.CorpusConfig;
import io.lexis.CorpusIndexer;
import io.lexis.IndexConfig;
import io.lexis.embeddings.EmbeddingConfig;
import io.lexis.store.FileIndexStorage;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Corpus and index parameters shared by the lexis goals.
 */
public abstract class AbstractLexisMojo extends AbstractMojo {
    
    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    protected MavenProject project;
    
    /**
     * Index file.
     */
    @Parameter(property = "lexis.index", defaultValue = "${project.build.directory}/lexis/lexis-index.json")
    protected File indexFile;
    
    /**
     * Additional directories to index besides the compile source roots.
     */
    @Parameter(property = "lexis.roots")
    protected List<File> roots;
    
    /**
     * Whether test source roots are indexed too.
     */
    @Parameter(property = "lexis.includeTests", defaultValue = "false")
    protected boolean includeTests;
    
    /**
     * File extensions to index.
     */
    @Parameter(property = "lexis.extensions", defaultValue = ".java,.kt,.md,.json,.ts,.js")
    protected List<String> extensions;
    
    /**
     * Files larger than this many bytes are skipped.
     */
    @Parameter(property = "lexis.maxFileBytes", defaultValue = "100000")
    protected long maxFileBytes;
    
    /**
     * Vocabulary size cap (vector dimensions).
     */
    @Parameter(property = "lexis.dimensions", defaultValue = "512")
    protected int dimensions;
    
    /**
     * Minimum corpus frequency for a term to enter the vocabulary.
     */
    @Parameter(property = "lexis.minTermFrequency", defaultValue = "2")
    protected int minTermFrequency;
    
    protected CorpusIndexer openIndexer() {
        return CorpusIndexer.builder()
            .corpus(corpusConfig())
            .config(IndexConfig.defaultConfig().withEmbedding(
                EmbeddingConfig.defaults()
                    .withDimensions(dimensions)
                    .withMinTermFrequency(minTermFrequency)))
            .storage(new FileIndexStorage(indexFile.toPath()))
            .build();
    }
    
    protected CorpusConfig corpusConfig() {
        Set<Path> sourceRoots = new LinkedHashSet<>();
        project.getCompileSourceRoots().forEach(root -> sourceRoots.add(Path.of(root)));
        if (includeTests) {
            project.getTestCompileSourceRoots().forEach(root -> sourceRoots.add(Path.of(root)));
        }
        if (roots != null) {
            roots.forEach(root -> sourceRoots.add(root.toPath()));
        }
        
        return CorpusConfig.forRoots(project.getBasedir().toPath(), new ArrayList<>(sourceRoots))
            .withExtensions(new LinkedHashSet<>(extensions))
            .withMaxFileBytes(maxFileBytes);
    }
}

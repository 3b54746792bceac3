package io.lexis.cli;

import io.lexis.CorpusConfig;
import io.lexis.CorpusIndexer;
import io.lexis.IndexConfig;
import io.lexis.embeddings.EmbeddingConfig;
import io.lexis.parser.PatternTopicalClassifier;
import io.lexis.parser.TopicalClassifier;
import io.lexis.store.FileIndexStorage;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Corpus and index options shared by every subcommand.
 */
class IndexOptions {
    
    @Option(names = {"-d", "--base-dir"}, description = "Base directory of the corpus", defaultValue = ".")
    Path baseDir;
    
    @Option(names = {"-r", "--root"}, description = "Directory to index, relative to the base directory (repeatable; default: src, scripts, docs)")
    List<Path> roots = new ArrayList<>();
    
    @Option(names = {"-i", "--index"}, description = "Index file (default: <base-dir>/.lexis/lexis-index.json)")
    Path indexFile;
    
    @Option(names = {"-e", "--ext"}, split = ",", description = "File extensions to index (default: .java,.ts,.js,.md,.json)")
    Set<String> extensions;
    
    @Option(names = {"--max-file-bytes"}, description = "Skip files larger than this", defaultValue = "100000")
    long maxFileBytes;
    
    @Option(names = {"--dimensions"}, description = "Vocabulary size cap (vector dimensions)", defaultValue = "512")
    int dimensions;
    
    @Option(names = {"--min-term-frequency"}, description = "Minimum corpus frequency for a term to enter the vocabulary", defaultValue = "2")
    int minTermFrequency;
    
    @Option(names = {"--threads"}, description = "Worker threads reading files during a rebuild")
    Integer threads;
    
    @Option(names = {"--tag-rule"}, description = "Topical tag rule as tag=regex, tried in order (repeatable)")
    Map<String, String> tagRules = new LinkedHashMap<>();
    
    /**
     * Resolves a command-line path against the base directory; absolute paths are kept.
     */
    Path resolve(Path file) {
        return baseDir.toAbsolutePath().normalize().resolve(file).normalize();
    }
    
    CorpusConfig corpusConfig() {
        Path base = baseDir.toAbsolutePath().normalize();
        CorpusConfig config = roots.isEmpty()
            ? CorpusConfig.defaults(base)
            : CorpusConfig.forRoots(base, roots.stream().map(this::resolve).toList());
        if (extensions != null && !extensions.isEmpty()) {
            config = config.withExtensions(extensions);
        }
        return config.withMaxFileBytes(maxFileBytes);
    }
    
    IndexConfig indexConfig() {
        IndexConfig config = IndexConfig.defaultConfig().withEmbedding(
            EmbeddingConfig.defaults()
                .withDimensions(dimensions)
                .withMinTermFrequency(minTermFrequency));
        return threads != null ? config.withWorkerThreads(threads) : config;
    }
    
    TopicalClassifier classifier() {
        if (tagRules.isEmpty()) {
            return TopicalClassifier.constant(TopicalClassifier.DEFAULT_TAG);
        }
        PatternTopicalClassifier.Builder builder = PatternTopicalClassifier.builder();
        tagRules.forEach(builder::rule);
        return builder.build();
    }
    
    Path resolvedIndexFile() {
        return indexFile != null
            ? indexFile.toAbsolutePath().normalize()
            : baseDir.toAbsolutePath().normalize().resolve(".lexis").resolve("lexis-index.json");
    }
    
    CorpusIndexer openIndexer() {
        return CorpusIndexer.builder()
            .corpus(corpusConfig())
            .config(indexConfig())
            .classifier(classifier())
            .storage(new FileIndexStorage(resolvedIndexFile()))
            .build();
    }
}

package io.lexis.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lexis.*;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Lexis.
 */
@Command(
    name = "lexis",
    mixinStandardHelpOptions = true,
    version = "lexis 1.0.0",
    description = "Build and query a lexical TF-IDF index over a source tree",
    subcommands = {
        LexisCli.RebuildCommand.class,
        LexisCli.SyncCommand.class,
        LexisCli.SearchCommand.class,
        LexisCli.StatsCommand.class,
        LexisCli.AddCommand.class,
        LexisCli.RemoveCommand.class
    }
)
public class LexisCli implements Callable<Integer> {
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new LexisCli()).execute(args);
        System.exit(exitCode);
    }
    
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
    
    static ObjectMapper jsonMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    /**
     * Result line of a search, without the embedding.
     */
    record SearchHit(String path, double score, String topicalTag, String summary,
                     List<String> declaredSymbols, List<String> highlights) {
        
        static SearchHit of(SearchResult result) {
            DocumentRecord document = result.document();
            return new SearchHit(document.relativePath(), result.score(), document.topicalTag(),
                document.summary(), document.declaredSymbols(), result.highlights());
        }
    }
    
    /**
     * Rebuild the whole index.
     */
    @Command(
        name = "rebuild",
        description = "Re-read the corpus and rebuild vocabulary and documents"
    )
    static class RebuildCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Option(names = {"--json"}, description = "Print the report as JSON")
        private boolean json;
        
        @Override
        public Integer call() throws Exception {
            try (CorpusIndexer indexer = options.openIndexer()) {
                RebuildReport report = indexer.rebuild();
                
                if (json) {
                    System.out.println(jsonMapper().writeValueAsString(report));
                    return 0;
                }
                System.out.printf("Indexed %d of %d files (%d skipped)%n",
                    report.documentsIndexed(), report.filesFound(), report.filesSkipped());
                System.out.println("Vocabulary: " + report.vocabularySize() + " terms");
                System.out.printf("Took %d ms%n", report.duration().toMillis());
                System.out.println("Saved index to: " + options.resolvedIndexFile());
            }
            return 0;
        }
    }
    
    /**
     * Bring the index in line with the corpus.
     */
    @Command(
        name = "sync",
        description = "Index new and changed files and drop deleted ones, keeping the vocabulary"
    )
    static class SyncCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Option(names = {"--json"}, description = "Print the report as JSON")
        private boolean json;
        
        @Override
        public Integer call() throws Exception {
            try (CorpusIndexer indexer = options.openIndexer()) {
                if (!indexer.initialize()) {
                    System.out.println("No usable index found, rebuilt from corpus");
                }
                SyncReport report = indexer.synchronize();
                
                if (json) {
                    System.out.println(jsonMapper().writeValueAsString(report));
                    return 0;
                }
                System.out.printf("Added %d, updated %d, unchanged %d, removed %d%n",
                    report.added(), report.updated(), report.unchanged(), report.removed());
            }
            return 0;
        }
    }
    
    /**
     * Query the index.
     */
    @Command(
        name = "search",
        description = "Rank indexed files against a query"
    )
    static class SearchCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Parameters(arity = "1..*", description = "Search query")
        private List<String> queryWords;
        
        @Option(names = {"-n", "--limit"}, description = "Number of results", defaultValue = "10")
        private int limit;
        
        @Option(names = {"-t", "--tag"}, description = "Boost documents whose topical tag contains this")
        private String tag;
        
        @Option(names = {"--min-score"}, description = "Drop results scoring below this", defaultValue = "0.1")
        private double minScore;
        
        @Option(names = {"--json"}, description = "Print results as JSON")
        private boolean json;
        
        @Override
        public Integer call() throws Exception {
            String query = String.join(" ", queryWords);
            SearchOptions searchOptions = new SearchOptions(limit, tag, minScore);
            
            try (CorpusIndexer indexer = options.openIndexer()) {
                indexer.initialize();
                List<SearchResult> results = indexer.search(query, searchOptions);
                
                if (json) {
                    System.out.println(jsonMapper().writeValueAsString(
                        results.stream().map(SearchHit::of).toList()));
                    return 0;
                }
                
                System.out.println("Searching for: " + query);
                System.out.println();
                System.out.println("Found " + results.size() + " results:");
                System.out.println("=".repeat(60));
                
                int rank = 1;
                for (SearchResult result : results) {
                    printResult(rank++, result);
                }
            }
            return 0;
        }
        
        private void printResult(int rank, SearchResult result) {
            DocumentRecord document = result.document();
            
            System.out.println();
            System.out.printf("#%d [%.3f] %s (%s)%n", rank, result.score(),
                document.relativePath(), document.topicalTag());
            if (!document.summary().isEmpty()) {
                String summary = document.summary();
                System.out.println("    " + (summary.length() > 80 ? summary.substring(0, 80) + "..." : summary));
            }
            if (!result.highlights().isEmpty()) {
                System.out.println("    Highlight: " + result.highlights().get(0).replace('\n', ' '));
            }
        }
    }
    
    /**
     * Show index statistics.
     */
    @Command(
        name = "stats",
        description = "Show index statistics"
    )
    static class StatsCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Option(names = {"--json"}, description = "Print statistics as JSON")
        private boolean json;
        
        @Override
        public Integer call() throws Exception {
            try (CorpusIndexer indexer = options.openIndexer()) {
                indexer.initialize();
                IndexStats stats = indexer.getStats();
                
                if (json) {
                    System.out.println(jsonMapper().writeValueAsString(stats));
                    return 0;
                }
                
                System.out.println();
                System.out.println("Corpus Index Statistics");
                System.out.println("=".repeat(40));
                System.out.println("Documents: " + stats.documentCount());
                System.out.println("Vocabulary: " + stats.vocabularySize() + " terms");
                System.out.println("Dimensions: " + stats.dimensions());
                System.out.println("Created: " + stats.created());
                System.out.println("Last updated: " + stats.lastUpdated());
                System.out.println();
                System.out.println("Documents by tag:");
                stats.documentsByTag().forEach((tag, count) ->
                    System.out.println("  " + tag + ": " + count));
            }
            return 0;
        }
    }
    
    /**
     * Index individual files.
     */
    @Command(
        name = "add",
        description = "Index or re-index files against the current vocabulary"
    )
    static class AddCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Parameters(arity = "1..*", description = "Files to index")
        private List<Path> files;
        
        @Override
        public Integer call() throws Exception {
            try (CorpusIndexer indexer = options.openIndexer()) {
                indexer.initialize();
                int changed = 0;
                for (Path file : files) {
                    if (indexer.upsert(options.resolve(file))) {
                        changed++;
                        System.out.println("Indexed: " + file);
                    } else {
                        System.out.println("Unchanged or not indexable: " + file);
                    }
                }
                System.out.printf("%d of %d files indexed%n", changed, files.size());
            }
            return 0;
        }
    }
    
    /**
     * Drop individual files from the index.
     */
    @Command(
        name = "remove",
        description = "Remove files from the index"
    )
    static class RemoveCommand implements Callable<Integer> {
        
        @Mixin
        private IndexOptions options;
        
        @Parameters(arity = "1..*", description = "Files to remove")
        private List<Path> files;
        
        @Override
        public Integer call() throws Exception {
            try (CorpusIndexer indexer = options.openIndexer()) {
                indexer.initialize();
                int removed = 0;
                for (Path file : files) {
                    if (indexer.remove(options.resolve(file))) {
                        removed++;
                    } else {
                        System.out.println("Not indexed: " + file);
                    }
                }
                System.out.printf("Removed %d of %d files%n", removed, files.size());
            }
            return 0;
        }
    }
}

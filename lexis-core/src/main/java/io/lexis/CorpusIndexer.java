package io.lexis;

import io.lexis.embeddings.TfIdfEncoder;
import io.lexis.embeddings.Tokenizer;
import io.lexis.embeddings.Vocabulary;
import io.lexis.embeddings.VocabularyBuilder;
import io.lexis.parser.JavaSourceMetadataExtractor;
import io.lexis.parser.MetadataExtractor;
import io.lexis.parser.RegexMetadataExtractor;
import io.lexis.parser.TopicalClassifier;
import io.lexis.store.CorpusIndex;
import io.lexis.store.IndexCodec;
import io.lexis.store.IndexStorage;
import io.lexis.store.InvalidIndexException;
import io.lexis.store.InMemoryIndexStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns a corpus index and keeps it in step with the files on disk.
 * 
 * <p>Typical usage:</p>
 * <pre>{@code
 * try (CorpusIndexer indexer = CorpusIndexer.builder()
 *         .corpus(CorpusConfig.defaults(projectDir))
 *         .storage(new FileIndexStorage(projectDir.resolve("lexis-index.json")))
 *         .build()) {
 *     indexer.initialize();
 *     List<SearchResult> results = indexer.search("token bucket", SearchOptions.defaults());
 * }
 * }</pre>
 * 
 * <p>Mutating operations and {@link #save()} hold the write lock, queries hold
 * the read lock. Every mutation is persisted before the call returns; when the
 * write fails the {@link IOException} propagates and the in-memory change is
 * kept.</p>
 */
public class CorpusIndexer implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(CorpusIndexer.class);
    
    private final IndexConfig indexConfig;
    private final IndexStorage storage;
    private final IndexCodec codec;
    private final Tokenizer tokenizer;
    private final VocabularyBuilder vocabularyBuilder;
    private final CorpusWalker walker;
    private final DocumentEncoder documentEncoder;
    private final SearchRanker ranker;
    private final ExecutorService readers;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    private CorpusIndex index;
    
    private CorpusIndexer(Builder builder) {
        this.indexConfig = builder.indexConfig;
        this.storage = builder.storage;
        this.codec = new IndexCodec();
        this.tokenizer = Tokenizer.from(indexConfig.embedding());
        this.vocabularyBuilder = new VocabularyBuilder(indexConfig.embedding());
        this.walker = new CorpusWalker(builder.corpusConfig);
        this.documentEncoder = new DocumentEncoder(indexConfig,
            builder.extractor != null ? builder.extractor
                : new JavaSourceMetadataExtractor(
                    new RegexMetadataExtractor(indexConfig.summaryLength(), indexConfig.summaryLines())),
            builder.classifier);
        this.ranker = new SearchRanker(indexConfig, tokenizer);
        this.readers = Executors.newFixedThreadPool(indexConfig.workerThreads(), new ReaderThreadFactory());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    // ==================== Lifecycle ====================
    
    /**
     * Loads the persisted index, or rebuilds from the corpus when none is
     * stored or the stored one is invalid.
     * 
     * @return true if the index was loaded, false if it was rebuilt
     * @throws IOException if the rebuild fails
     */
    public boolean initialize() throws IOException {
        lock.writeLock().lock();
        try {
            Optional<CorpusIndex> loaded = load();
            if (loaded.isPresent()) {
                index = loaded.get();
                log.info("Loaded index from {}: {} documents, {} terms",
                    storage.describe(), index.documentCount(), index.vocabulary().size());
                return true;
            }
            rebuildLocked();
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private Optional<CorpusIndex> load() {
        try {
            Optional<byte[]> data = storage.read();
            if (data.isEmpty()) {
                log.info("No stored index at {}, building from corpus", storage.describe());
                return Optional.empty();
            }
            CorpusIndex decoded = codec.decode(data.get());
            if (decoded.dimensions() != indexConfig.embedding().dimensions()) {
                log.warn("Stored index has {} dimensions but {} are configured, rebuilding",
                    decoded.dimensions(), indexConfig.embedding().dimensions());
                return Optional.empty();
            }
            return Optional.of(decoded);
        } catch (InvalidIndexException e) {
            log.warn("Stored index at {} is invalid, rebuilding: {}", storage.describe(), e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot read stored index at {}, rebuilding: {}", storage.describe(), e.getMessage());
            return Optional.empty();
        }
    }
    
    public boolean isInitialized() {
        lock.readLock().lock();
        try {
            return index != null;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public void close() {
        readers.shutdown();
    }
    
    // ==================== Full rebuild ====================
    
    /**
     * Re-reads the whole corpus, builds a fresh vocabulary and replaces every
     * document. Nothing is replaced when the corpus cannot be walked.
     */
    public RebuildReport rebuild() throws IOException {
        lock.writeLock().lock();
        try {
            return rebuildLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private RebuildReport rebuildLocked() throws IOException {
        long start = System.nanoTime();
        
        List<Path> files = walker.walk();
        List<SourceFile> sources = new ArrayList<>();
        for (SourceFile source : readAll(files)) {
            if (!source.tokens().isEmpty()) {
                sources.add(source);
            }
        }
        
        List<List<String>> corpus = new ArrayList<>(sources.size());
        for (SourceFile source : sources) {
            corpus.add(source.tokens());
        }
        Vocabulary vocabulary = vocabularyBuilder.build(corpus);
        TfIdfEncoder encoder = new TfIdfEncoder(vocabulary, tokenizer);
        
        List<DocumentRecord> records = new ArrayList<>(sources.size());
        for (SourceFile source : sources) {
            documentEncoder.encode(source, encoder).ifPresent(records::add);
        }
        
        if (index == null) {
            index = CorpusIndex.empty(indexConfig.embedding().dimensions());
        }
        index.replaceAll(vocabulary, records);
        saveLocked();
        
        RebuildReport report = new RebuildReport(
            files.size(),
            records.size(),
            files.size() - records.size(),
            vocabulary.size(),
            Duration.ofNanos(System.nanoTime() - start)
        );
        log.info("Rebuilt index: {} of {} files indexed, {} terms in {} ms",
            report.documentsIndexed(), report.filesFound(), report.vocabularySize(),
            report.duration().toMillis());
        return report;
    }
    
    /**
     * Reads and tokenizes files on the worker pool, returning them in input order.
     */
    private List<SourceFile> readAll(List<Path> files) throws IOException {
        List<Future<Optional<SourceFile>>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(readers.submit(() -> walker.read(file, tokenizer)));
        }
        
        List<SourceFile> sources = new ArrayList<>(files.size());
        try {
            for (Future<Optional<SourceFile>> future : futures) {
                future.get().ifPresent(sources::add);
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading corpus");
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IOException("Failed to read corpus: " + e.getCause().getMessage(), e.getCause());
        }
        return sources;
    }
    
    // ==================== Incremental updates ====================
    
    /**
     * Indexes or re-indexes one file against the current vocabulary.
     * 
     * <p>Missing, oversized, unreadable and token-less files are ignored, as is
     * a file whose content has not changed since it was indexed. When the index
     * has no vocabulary yet, one is bootstrapped from this file.</p>
     * 
     * @return true if the index changed
     */
    public boolean upsert(Path file) throws IOException {
        lock.writeLock().lock();
        try {
            requireInitialized("upsert");
            
            if (!walker.isIndexable(file)) {
                log.debug("Not indexable, ignoring: {}", file);
                return false;
            }
            Optional<SourceFile> source = walker.read(file, tokenizer);
            if (source.isEmpty()) {
                return false;
            }
            if (!apply(source.get())) {
                return false;
            }
            saveLocked();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Removes the document for a file, if it is indexed.
     * 
     * @return true if a document was removed
     */
    public boolean remove(Path file) throws IOException {
        lock.writeLock().lock();
        try {
            requireInitialized("remove");
            
            if (!index.remove(DocumentRecord.idFor(file))) {
                log.debug("Not indexed, nothing to remove: {}", file);
                return false;
            }
            saveLocked();
            log.info("Removed {}", walker.relativize(file));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Brings the index in line with the corpus without rebuilding the vocabulary.
     * 
     * <p>New and changed files are encoded, unchanged files (same content hash)
     * are left alone, and documents whose file is no longer part of the corpus
     * are removed. The index is saved once, and only if something changed.</p>
     */
    public SyncReport synchronize() throws IOException {
        lock.writeLock().lock();
        try {
            requireInitialized("synchronize");
            
            List<Path> files = walker.walk();
            Set<String> present = new HashSet<>();
            int added = 0;
            int updated = 0;
            int unchanged = 0;
            
            for (SourceFile source : readAll(files)) {
                if (source.tokens().isEmpty()) {
                    continue;
                }
                String id = DocumentRecord.idFor(source.path());
                present.add(id);
                boolean known = index.get(id).isPresent();
                if (!apply(source)) {
                    unchanged++;
                } else if (known) {
                    updated++;
                } else {
                    added++;
                }
            }
            
            List<String> stale = new ArrayList<>();
            for (DocumentRecord record : index.documents()) {
                if (!present.contains(record.id())) {
                    stale.add(record.id());
                }
            }
            stale.forEach(index::remove);
            
            SyncReport report = new SyncReport(added, updated, unchanged, stale.size());
            if (report.changed()) {
                saveLocked();
            }
            log.info("Synchronized index: {} added, {} updated, {} unchanged, {} removed",
                added, updated, unchanged, stale.size());
            return report;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Encodes a file into the index unless its stored record is current.
     * 
     * @return true if the index changed
     */
    private boolean apply(SourceFile source) {
        if (source.tokens().isEmpty()) {
            log.debug("No tokens, ignoring: {}", source.relativePath());
            return false;
        }
        
        String hash = DocumentRecord.hashContent(source.content());
        Optional<DocumentRecord> existing = index.get(DocumentRecord.idFor(source.path()));
        if (existing.isPresent() && existing.get().contentHash().equals(hash)) {
            log.debug("Unchanged, skipping: {}", source.relativePath());
            return false;
        }
        
        if (!index.isBuilt()) {
            Vocabulary bootstrap = vocabularyBuilder.bootstrap(source.tokens());
            index.adoptVocabulary(bootstrap);
            log.info("Bootstrapped vocabulary of {} terms from {}", bootstrap.size(), source.relativePath());
        }
        
        TfIdfEncoder encoder = new TfIdfEncoder(index.vocabulary(), tokenizer);
        Optional<DocumentRecord> record = documentEncoder.encode(source, encoder);
        if (record.isEmpty()) {
            return false;
        }
        index.put(record.get());
        log.debug("{} {}", existing.isPresent() ? "Updated" : "Added", source.relativePath());
        return true;
    }
    
    // ==================== Queries ====================
    
    public List<SearchResult> search(String query, SearchOptions options) {
        lock.readLock().lock();
        try {
            requireInitialized("search");
            return ranker.search(index, query, options);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public List<SearchResult> search(String query) {
        return search(query, SearchOptions.defaults());
    }
    
    public IndexStats getStats() {
        lock.readLock().lock();
        try {
            requireInitialized("read stats");
            return index.stats();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public Optional<DocumentRecord> findDocument(Path file) {
        lock.readLock().lock();
        try {
            requireInitialized("find document");
            return index.get(DocumentRecord.idFor(file));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    // ==================== Persistence ====================
    
    public void save() throws IOException {
        lock.writeLock().lock();
        try {
            requireInitialized("save");
            saveLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private void saveLocked() throws IOException {
        storage.write(codec.encode(index));
        log.debug("Saved {} documents to {}", index.documentCount(), storage.describe());
    }
    
    private void requireInitialized(String operation) {
        if (index == null) {
            throw new IndexNotInitializedException(operation);
        }
    }
    
    private static class ReaderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "lexis-reader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
    
    public static class Builder {
        private CorpusConfig corpusConfig;
        private IndexConfig indexConfig = IndexConfig.defaultConfig();
        private IndexStorage storage;
        private MetadataExtractor extractor;
        private TopicalClassifier classifier = TopicalClassifier.constant(TopicalClassifier.DEFAULT_TAG);
        
        public Builder corpus(CorpusConfig corpusConfig) {
            this.corpusConfig = corpusConfig;
            return this;
        }
        
        public Builder config(IndexConfig indexConfig) {
            this.indexConfig = indexConfig;
            return this;
        }
        
        public Builder storage(IndexStorage storage) {
            this.storage = storage;
            return this;
        }
        
        public Builder extractor(MetadataExtractor extractor) {
            this.extractor = extractor;
            return this;
        }
        
        public Builder classifier(TopicalClassifier classifier) {
            this.classifier = classifier;
            return this;
        }
        
        public CorpusIndexer build() {
            Objects.requireNonNull(corpusConfig, "corpus configuration is required");
            Objects.requireNonNull(indexConfig, "indexConfig cannot be null");
            Objects.requireNonNull(classifier, "classifier cannot be null");
            if (storage == null) {
                storage = new InMemoryIndexStorage();
            }
            return new CorpusIndexer(this);
        }
    }
}

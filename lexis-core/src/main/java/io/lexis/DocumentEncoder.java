package io.lexis;

import io.lexis.embeddings.TfIdfEncoder;
import io.lexis.parser.DocumentMetadata;
import io.lexis.parser.JavaSourceMetadataExtractor;
import io.lexis.parser.MetadataExtractor;
import io.lexis.parser.RegexMetadataExtractor;
import io.lexis.parser.TopicalClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns a {@link SourceFile} into a {@link DocumentRecord}.
 * 
 * <p>The embedding comes from the supplied encoder. Metadata extraction and
 * classification are best effort: when either fails the record gets an empty
 * value (or the default tag) instead.</p>
 */
public class DocumentEncoder {
    
    private static final Logger log = LoggerFactory.getLogger(DocumentEncoder.class);
    
    private final IndexConfig config;
    private final MetadataExtractor extractor;
    private final TopicalClassifier classifier;
    
    public DocumentEncoder(IndexConfig config) {
        this(config,
            new JavaSourceMetadataExtractor(new RegexMetadataExtractor(config.summaryLength(), config.summaryLines())),
            TopicalClassifier.constant(TopicalClassifier.DEFAULT_TAG));
    }
    
    public DocumentEncoder(IndexConfig config, MetadataExtractor extractor, TopicalClassifier classifier) {
        this.config = config;
        this.extractor = extractor;
        this.classifier = classifier;
    }
    
    /**
     * Encodes a file.
     * 
     * @return the record, or empty when the file has no tokens
     */
    public Optional<DocumentRecord> encode(SourceFile source, TfIdfEncoder encoder) {
        if (source.tokens().isEmpty()) {
            log.debug("Skipping file without tokens: {}", source.relativePath());
            return Optional.empty();
        }
        
        String content = source.content();
        float[] embedding = encoder.embedTokens(source.tokens());
        DocumentMetadata metadata = extractMetadata(source);
        
        return Optional.of(new DocumentRecord(
            DocumentRecord.idFor(source.path()),
            source.path().toString(),
            source.relativePath(),
            classify(source),
            content.length() > config.previewLength() ? content.substring(0, config.previewLength()) : content,
            metadata.summary(),
            metadata.declaredSymbols(),
            metadata.referencedModules(),
            content.split("\n", -1).length,
            source.lastModified(),
            DocumentRecord.hashContent(content),
            embedding
        ));
    }
    
    private DocumentMetadata extractMetadata(SourceFile source) {
        try {
            return extractor.extract(source.path(), source.content());
        } catch (RuntimeException e) {
            log.debug("Metadata extraction failed for {}: {}", source.relativePath(), e.toString());
            return DocumentMetadata.empty();
        }
    }
    
    private String classify(SourceFile source) {
        try {
            String tag = classifier.classify(source.relativePath(), source.content());
            return tag != null && !tag.isBlank() ? tag : TopicalClassifier.DEFAULT_TAG;
        } catch (RuntimeException e) {
            log.debug("Classification failed for {}: {}", source.relativePath(), e.toString());
            return TopicalClassifier.DEFAULT_TAG;
        }
    }
}

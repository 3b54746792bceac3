package io.lexis.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.lexis.DocumentRecord;
import io.lexis.embeddings.Vocabulary;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts a {@link CorpusIndex} to and from its JSON document.
 * 
 * <p>Decoding validates the document's internal consistency and rejects
 * anything that could not have been written by {@link #encode}.</p>
 */
public class IndexCodec {
    
    private final ObjectMapper mapper;
    
    public IndexCodec() {
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    public byte[] encode(CorpusIndex index) throws IOException {
        Vocabulary vocabulary = index.vocabulary();
        Map<String, DocumentRecord> documents = new LinkedHashMap<>();
        for (DocumentRecord record : index.documents()) {
            documents.put(record.id(), record);
        }
        
        PersistedIndex persisted = new PersistedIndex(
            CorpusIndex.FORMAT_VERSION,
            index.created(),
            index.updated(),
            documents.size(),
            vocabulary.dimensions(),
            vocabulary.termIndex(),
            vocabulary.idfScores(),
            documents,
            index.isBuilt()
        );
        return mapper.writeValueAsBytes(persisted);
    }
    
    public CorpusIndex decode(byte[] data) throws IOException {
        PersistedIndex persisted;
        try {
            persisted = mapper.readValue(data, PersistedIndex.class);
        } catch (JsonProcessingException e) {
            throw new InvalidIndexException("Malformed index document: " + e.getOriginalMessage(), e);
        }
        if (persisted == null) {
            throw new InvalidIndexException("Empty index document");
        }
        
        if (!CorpusIndex.FORMAT_VERSION.equals(persisted.version())) {
            throw new UnsupportedFormatException(persisted.version());
        }
        
        Map<String, DocumentRecord> documents = persisted.documents() != null ? persisted.documents() : Map.of();
        if (persisted.documentCount() != documents.size()) {
            throw new InvalidIndexException(String.format(
                "documentCount %d disagrees with %d stored documents",
                persisted.documentCount(), documents.size()));
        }
        
        Vocabulary vocabulary;
        try {
            vocabulary = Vocabulary.of(
                persisted.dimension(),
                persisted.vocabulary() != null ? persisted.vocabulary() : Map.of(),
                persisted.idfScores() != null ? persisted.idfScores() : Map.of()
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidIndexException("Invalid vocabulary: " + e.getMessage(), e);
        }
        
        try {
            return CorpusIndex.restore(vocabulary, documents,
                persisted.created(), persisted.updated(), persisted.built());
        } catch (IllegalArgumentException e) {
            throw new InvalidIndexException("Invalid documents: " + e.getMessage(), e);
        }
    }
}

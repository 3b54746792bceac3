package io.lexis.embeddings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Vocabulary} from the token sequences of a whole corpus.
 * 
 * <p>Admission and IDF both use the global term frequency (occurrences across
 * the whole corpus), not the number of documents containing the term:</p>
 * <pre>
 *   idf(term) = ln(1 + documentCount / (1 + globalFrequency(term)))
 * </pre>
 * 
 * <p>Terms below {@code minTermFrequency} are dropped; the rest are ranked by
 * descending frequency, ties broken by ascending term, and the first
 * {@code dimensions} receive indexes 0..D-1. The ordering depends only on the
 * counts, so the order in which sequences are supplied does not matter.</p>
 */
public class VocabularyBuilder {
    
    private static final Logger log = LoggerFactory.getLogger(VocabularyBuilder.class);
    
    private static final Comparator<Map.Entry<String, Long>> BY_FREQUENCY =
        Map.Entry.<String, Long>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Long>comparingByKey());
    
    private final int dimensions;
    private final int minTermFrequency;
    
    public VocabularyBuilder(EmbeddingConfig config) {
        this(config.dimensions(), config.minTermFrequency());
    }
    
    public VocabularyBuilder(int dimensions, int minTermFrequency) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got " + dimensions);
        }
        this.dimensions = dimensions;
        this.minTermFrequency = minTermFrequency;
    }
    
    /**
     * Builds a vocabulary over a corpus.
     * 
     * @param documents token sequence of every document in the corpus
     * @return the frozen vocabulary
     */
    public Vocabulary build(List<List<String>> documents) {
        Map<String, Long> frequencies = new HashMap<>();
        for (List<String> tokens : documents) {
            for (String token : tokens) {
                frequencies.merge(token, 1L, Long::sum);
            }
        }
        
        Vocabulary vocabulary = build(frequencies, Math.max(1, documents.size()));
        log.debug("Built vocabulary from {} documents: {}", documents.size(), vocabulary);
        return vocabulary;
    }
    
    /**
     * Builds a one-document vocabulary, used when a single file is indexed before any full build.
     */
    public Vocabulary bootstrap(List<String> tokens) {
        return build(List.of(tokens));
    }
    
    private Vocabulary build(Map<String, Long> frequencies, int documentCount) {
        List<Map.Entry<String, Long>> admitted = new ArrayList<>();
        for (Map.Entry<String, Long> entry : frequencies.entrySet()) {
            if (entry.getValue() >= minTermFrequency) {
                admitted.add(entry);
            }
        }
        admitted.sort(BY_FREQUENCY);
        
        Map<String, Integer> termIndex = new LinkedHashMap<>();
        for (int i = 0; i < Math.min(dimensions, admitted.size()); i++) {
            termIndex.put(admitted.get(i).getKey(), i);
        }
        
        Map<String, Double> idfScores = new HashMap<>();
        for (Map.Entry<String, Long> entry : frequencies.entrySet()) {
            idfScores.put(entry.getKey(), Math.log(1.0 + (double) documentCount / (1.0 + entry.getValue())));
        }
        
        return Vocabulary.of(dimensions, termIndex, idfScores);
    }
}

package io.lexis.embeddings;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TF-IDF embedding model bound to one frozen {@link Vocabulary}.
 * 
 * <p>For every term present in both the text and the vocabulary,
 * {@code embedding[index(term)] = termFrequency * idf(term)}; every other
 * component is zero. The result is L2-normalized, so a text sharing no term
 * with the vocabulary encodes to the zero vector.</p>
 * 
 * <p>Documents and queries go through the same encoder, so their vectors
 * live in the same space.</p>
 */
public class TfIdfEncoder {
    
    private final Vocabulary vocabulary;
    private final Tokenizer tokenizer;
    
    public TfIdfEncoder(Vocabulary vocabulary, Tokenizer tokenizer) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary cannot be null");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer cannot be null");
    }
    
    public float[] embed(String text) {
        return embedTokens(tokenizer.tokenize(text));
    }
    
    /**
     * Encodes an already tokenized text.
     */
    public float[] embedTokens(List<String> tokens) {
        Map<String, Integer> termFrequency = new HashMap<>();
        for (String token : tokens) {
            termFrequency.merge(token, 1, Integer::sum);
        }
        
        float[] embedding = new float[vocabulary.dimensions()];
        for (Map.Entry<String, Integer> entry : termFrequency.entrySet()) {
            int index = vocabulary.indexOf(entry.getKey());
            if (index >= 0) {
                embedding[index] = (float) (entry.getValue() * vocabulary.idf(entry.getKey()));
            }
        }
        
        Vectors.normalize(embedding);
        return embedding;
    }
    
    public int getDimensions() {
        return vocabulary.dimensions();
    }
    
    public Vocabulary getVocabulary() {
        return vocabulary;
    }
}

package io.lexis.embeddings;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Frozen term-to-dimension mapping plus the IDF table it was built with.
 * 
 * <p>A vocabulary is produced once by {@link VocabularyBuilder} and never
 * modified afterwards. Every vector encoded against it has exactly
 * {@link #dimensions()} components; terms outside the vocabulary contribute
 * nothing even when they carry an IDF entry.</p>
 */
public final class Vocabulary {
    
    private final int dimensions;
    private final Map<String, Integer> termIndex;
    private final Map<String, Double> idfScores;
    
    private Vocabulary(int dimensions, Map<String, Integer> termIndex, Map<String, Double> idfScores) {
        this.dimensions = dimensions;
        this.termIndex = Collections.unmodifiableMap(termIndex);
        this.idfScores = Collections.unmodifiableMap(idfScores);
    }
    
    /**
     * Creates a vocabulary with no terms. Every vector encoded against it is all zeros.
     */
    public static Vocabulary empty(int dimensions) {
        return of(dimensions, Map.of(), Map.of());
    }
    
    /**
     * Creates a vocabulary from an existing mapping, validating its structure.
     * 
     * @param dimensions vector dimensions
     * @param termIndex term to dimension index, each index unique and in {@code [0, dimensions)}
     * @param idfScores term to IDF weight; must cover every vocabulary term
     * @throws IllegalArgumentException if the mapping is inconsistent
     */
    public static Vocabulary of(int dimensions, Map<String, Integer> termIndex, Map<String, Double> idfScores) {
        Objects.requireNonNull(termIndex, "termIndex cannot be null");
        Objects.requireNonNull(idfScores, "idfScores cannot be null");
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got " + dimensions);
        }
        if (termIndex.size() > dimensions) {
            throw new IllegalArgumentException(String.format(
                "Vocabulary has %d terms but only %d dimensions", termIndex.size(), dimensions));
        }
        
        BitSet used = new BitSet(dimensions);
        for (Map.Entry<String, Integer> entry : termIndex.entrySet()) {
            Integer index = entry.getValue();
            if (index == null || index < 0 || index >= dimensions) {
                throw new IllegalArgumentException(String.format(
                    "Term '%s' has dimension %s outside [0, %d)", entry.getKey(), index, dimensions));
            }
            if (used.get(index)) {
                throw new IllegalArgumentException(String.format(
                    "Dimension %d is assigned to more than one term", index));
            }
            used.set(index);
            
            Double idf = idfScores.get(entry.getKey());
            if (idf == null || idf.isNaN() || idf < 0) {
                throw new IllegalArgumentException("Missing or negative IDF for term '" + entry.getKey() + "'");
            }
        }
        
        return new Vocabulary(dimensions, new LinkedHashMap<>(termIndex), new LinkedHashMap<>(idfScores));
    }
    
    /**
     * Returns the dimension index of a term, or -1 when the term is not in the vocabulary.
     */
    public int indexOf(String term) {
        Integer index = termIndex.get(term);
        return index != null ? index : -1;
    }
    
    public boolean contains(String term) {
        return termIndex.containsKey(term);
    }
    
    /**
     * Returns the IDF weight of a term, or 0 when the term was never observed.
     */
    public double idf(String term) {
        return idfScores.getOrDefault(term, 0.0);
    }
    
    /**
     * Term to dimension index, in dimension order.
     */
    public Map<String, Integer> termIndex() {
        return termIndex;
    }
    
    /**
     * IDF weight of every observed term, including terms not admitted to the vocabulary.
     */
    public Map<String, Double> idfScores() {
        return idfScores;
    }
    
    public int dimensions() {
        return dimensions;
    }
    
    /**
     * Number of admitted terms (at most {@link #dimensions()}).
     */
    public int size() {
        return termIndex.size();
    }
    
    public boolean isEmpty() {
        return termIndex.isEmpty();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vocabulary other)) return false;
        return dimensions == other.dimensions
            && termIndex.equals(other.termIndex)
            && idfScores.equals(other.idfScores);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(dimensions, termIndex, idfScores);
    }
    
    @Override
    public String toString() {
        return String.format("Vocabulary[terms=%d, dimensions=%d, observed=%d]",
            termIndex.size(), dimensions, idfScores.size());
    }
}

package io.lexis.embeddings;

/**
 * Vector helpers shared by encoding and ranking.
 */
public final class Vectors {
    
    private Vectors() {
    }
    
    /**
     * Scales a vector to unit length in place. A zero vector is left unchanged.
     */
    public static void normalize(float[] vector) {
        double norm = norm(vector);
        if (norm == 0) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
    }
    
    /**
     * Euclidean length of a vector.
     */
    public static double norm(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }
    
    /**
     * Dot product of two vectors, 0 when their lengths differ.
     * 
     * <p>For unit vectors this equals cosine similarity.</p>
     */
    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            return 0;
        }
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }
    
    /**
     * Cosine similarity of two arbitrary vectors, 0 when either is zero or lengths differ.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            return 0;
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0 || normB == 0) {
            return 0;
        }
        double cosine = dot(a, b) / (normA * normB);
        // clamp rounding error
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}

package io.lexis.embeddings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorsTest {
    
    @Test
    void testNormalize() {
        float[] vector = {3f, 4f};
        
        Vectors.normalize(vector);
        
        assertEquals(0.6f, vector[0], 1e-6);
        assertEquals(0.8f, vector[1], 1e-6);
    }
    
    @Test
    void testNormalizeLeavesZeroVector() {
        float[] vector = new float[3];
        
        Vectors.normalize(vector);
        
        assertArrayEquals(new float[3], vector);
    }
    
    @Test
    void testDotOfMismatchedLengthsIsZero() {
        assertEquals(0.0, Vectors.dot(new float[]{1f}, new float[]{1f, 0f}));
    }
    
    @Test
    void testCosineSimilarity() {
        float[] a = {1f, 0f};
        float[] b = {-2f, 0f};
        float[] c = {0f, 5f};
        
        assertEquals(1.0, Vectors.cosineSimilarity(a, a), 1e-9);
        assertEquals(-1.0, Vectors.cosineSimilarity(a, b), 1e-9);
        assertEquals(0.0, Vectors.cosineSimilarity(a, c), 1e-9);
        assertEquals(0.0, Vectors.cosineSimilarity(a, new float[2]));
    }
}

package io.lexis.embeddings;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {
    
    @Test
    void testLowercasesAndSplitsOnPunctuation() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        List<String> tokens = tokenizer.tokenize("VectorIndex.save(outputPath); // Flush-to-disk");
        
        assertEquals(List.of("vectorindex", "save", "outputpath", "flush", "disk"), tokens);
    }
    
    @Test
    void testDropsStopWords() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        List<String> tokens = tokenizer.tokenize("The quick fox and the lazy dog");
        
        assertEquals(List.of("quick", "fox", "lazy", "dog"), tokens);
    }
    
    @Test
    void testDropsTokensOutsideLengthBounds() {
        Tokenizer tokenizer = Tokenizer.defaults();
        String longToken = "x".repeat(31);
        String maxToken = "y".repeat(30);
        
        List<String> tokens = tokenizer.tokenize("x " + longToken + " " + maxToken + " ok");
        
        assertEquals(List.of(maxToken, "ok"), tokens);
    }
    
    @Test
    void testKeepsRepeatsInOrder() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        assertEquals(List.of("fox", "runs", "fox"), tokenizer.tokenize("fox runs fox"));
    }
    
    @Test
    void testKeepsDigits() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        assertEquals(List.of("utf8", "2024", "v2"), tokenizer.tokenize("UTF8 2024 v2"));
    }
    
    @Test
    void testKeepsCyrillicByDefault() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        List<String> tokens = tokenizer.tokenize("Памет и memory");
        
        assertEquals(List.of("памет", "memory"), tokens);
    }
    
    @Test
    void testAsciiOnlyWhenExtraScriptDisabled() {
        Tokenizer tokenizer = Tokenizer.builder().extraScript(null).build();
        
        List<String> tokens = tokenizer.tokenize("Памет memory");
        
        assertEquals(List.of("memory"), tokens);
    }
    
    @Test
    void testOtherScriptsAreSeparators() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        assertEquals(List.of("alpha", "beta"), tokenizer.tokenize("alpha日本beta"));
    }
    
    @Test
    void testCustomStopWords() {
        Tokenizer tokenizer = Tokenizer.builder().stopWords(Set.of("fox")).build();
        
        assertEquals(List.of("the", "quick"), tokenizer.tokenize("the quick fox"));
    }
    
    @Test
    void testEmptyAndNullInput() {
        Tokenizer tokenizer = Tokenizer.defaults();
        
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("  ... !! ").isEmpty());
    }
    
    @Test
    void testTokenizationIsDeterministic() {
        Tokenizer tokenizer = Tokenizer.defaults();
        String text = """
            /**
             * Builds the index over all configured roots.
             */
            public IndexReport rebuild(List<Path> roots) throws IOException {
                return walker.walk(roots).stream().map(this::encode).toList();
            }
            """;
        
        assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
    }
}

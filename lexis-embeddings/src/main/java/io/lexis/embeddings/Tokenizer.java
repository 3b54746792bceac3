package io.lexis.embeddings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into normalized terms.
 * 
 * <p>Steps:
 * <ul>
 *   <li>Lower-case the text</li>
 *   <li>Blank out everything but ASCII letters, digits and letters of the extra script</li>
 *   <li>Split on whitespace</li>
 *   <li>Drop tokens outside the length bounds and stop words</li>
 * </ul>
 * 
 * <p>No stemming is applied. Instances are immutable and safe to share between threads.</p>
 */
public class Tokenizer {
    
    private final int minLength;
    private final int maxLength;
    private final Character.UnicodeScript extraScript;
    private final Set<String> stopWords;
    
    private Tokenizer(Builder builder) {
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.extraScript = builder.extraScript;
        this.stopWords = Set.copyOf(builder.stopWords);
    }
    
    /**
     * Creates a tokenizer with default settings (English stop words, Cyrillic kept).
     */
    public static Tokenizer defaults() {
        return from(EmbeddingConfig.defaults());
    }
    
    /**
     * Creates a tokenizer matching the token settings of an embedding config.
     */
    public static Tokenizer from(EmbeddingConfig config) {
        return builder()
            .minLength(config.minTokenLength())
            .maxLength(config.maxTokenLength())
            .extraScript(config.extraScript())
            .stopWords(config.stopWords())
            .build();
    }
    
    /**
     * Creates a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Tokenizes text into terms, repeats included, in order of appearance.
     * 
     * @param text the text to tokenize (may be null)
     * @return list of normalized terms
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder current = new StringBuilder();
        
        int i = 0;
        while (i < lower.length()) {
            int codePoint = lower.codePointAt(i);
            if (isAllowed(codePoint)) {
                current.appendCodePoint(codePoint);
            } else {
                flush(current, tokens);
            }
            i += Character.charCount(codePoint);
        }
        flush(current, tokens);
        
        return tokens;
    }
    
    private void flush(StringBuilder current, List<String> tokens) {
        if (current.length() == 0) {
            return;
        }
        String token = current.toString();
        current.setLength(0);
        
        if (token.length() >= minLength
                && token.length() <= maxLength
                && !stopWords.contains(token)) {
            tokens.add(token);
        }
    }
    
    private boolean isAllowed(int codePoint) {
        if ((codePoint >= 'a' && codePoint <= 'z') || (codePoint >= '0' && codePoint <= '9')) {
            return true;
        }
        return extraScript != null
            && Character.isLetter(codePoint)
            && Character.UnicodeScript.of(codePoint) == extraScript;
    }
    
    public static class Builder {
        private int minLength = 2;
        private int maxLength = 30;
        private Character.UnicodeScript extraScript = Character.UnicodeScript.CYRILLIC;
        private Set<String> stopWords = EmbeddingConfig.DEFAULT_STOP_WORDS;
        
        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }
        
        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }
        
        public Builder extraScript(Character.UnicodeScript extraScript) {
            this.extraScript = extraScript;
            return this;
        }
        
        public Builder stopWords(Set<String> stopWords) {
            this.stopWords = stopWords != null ? stopWords : Set.of();
            return this;
        }
        
        public Tokenizer build() {
            return new Tokenizer(this);
        }
    }
}

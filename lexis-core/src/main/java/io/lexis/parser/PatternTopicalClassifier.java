package io.lexis.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tags a file with the first rule whose pattern occurs in its path or leading text.
 * 
 * <p>Rules are tried in registration order against the relative path followed
 * by the first {@value #SAMPLE_LENGTH} characters of the file.</p>
 * 
 * <pre>{@code
 * TopicalClassifier classifier = PatternTopicalClassifier.builder()
 *     .rule("security", "vault|encrypt|auth")
 *     .rule("storage", "index|persist|cache")
 *     .build();
 * }</pre>
 */
public class PatternTopicalClassifier implements TopicalClassifier {
    
    static final int SAMPLE_LENGTH = 500;
    
    private final List<Rule> rules;
    private final String fallbackTag;
    
    private PatternTopicalClassifier(Builder builder) {
        this.rules = List.copyOf(builder.rules);
        this.fallbackTag = builder.fallbackTag;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String classify(String relativePath, String content) {
        String sample = content.length() > SAMPLE_LENGTH ? content.substring(0, SAMPLE_LENGTH) : content;
        String combined = relativePath + " " + sample;
        
        for (Rule rule : rules) {
            if (rule.pattern().matcher(combined).find()) {
                return rule.tag();
            }
        }
        return fallbackTag;
    }
    
    /**
     * A tag and the pattern that selects it.
     */
    public record Rule(String tag, Pattern pattern) {}
    
    public static class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private String fallbackTag = DEFAULT_TAG;
        
        /**
         * Adds a case-insensitive rule.
         */
        public Builder rule(String tag, String regex) {
            return rule(tag, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        
        public Builder rule(String tag, Pattern pattern) {
            rules.add(new Rule(tag, pattern));
            return this;
        }
        
        public Builder fallbackTag(String fallbackTag) {
            this.fallbackTag = fallbackTag;
            return this;
        }
        
        public PatternTopicalClassifier build() {
            return new PatternTopicalClassifier(this);
        }
    }
}

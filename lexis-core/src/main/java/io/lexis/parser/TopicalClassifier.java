package io.lexis.parser;

/**
 * Assigns a single topical tag to a file.
 */
@FunctionalInterface
public interface TopicalClassifier {
    
    /** Tag used when no rule matches */
    String DEFAULT_TAG = "core";
    
    /**
     * Classifies a file.
     * 
     * @param relativePath corpus-relative path of the file
     * @param content the file text
     * @return the tag, never null
     */
    String classify(String relativePath, String content);
    
    /**
     * A classifier that tags every file the same way.
     */
    static TopicalClassifier constant(String tag) {
        return (relativePath, content) -> tag;
    }
}

package io.lexis;

import java.nio.file.Path;
import java.util.List;

/**
 * A file read from the corpus together with its tokens.
 */
public record SourceFile(
    /** Absolute path */
    Path path,
    
    /** Path relative to the corpus base directory, with forward slashes */
    String relativePath,
    
    /** Full text of the file */
    String content,
    
    /** Tokenizer output for the full text */
    List<String> tokens,
    
    /** Last modification time (epoch millis) */
    long lastModified
) {
    
    public SourceFile {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
    }
}

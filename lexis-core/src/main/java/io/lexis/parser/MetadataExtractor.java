package io.lexis.parser;

import java.nio.file.Path;
import java.util.List;

/**
 * Heuristic extraction of descriptive metadata from a file.
 * 
 * <p>Every method returns an empty value when it finds nothing; none of them
 * affects the document's embedding.</p>
 */
public interface MetadataExtractor {
    
    /**
     * Short human-readable description of the file.
     */
    String summary(Path path, String content);
    
    /**
     * Names the file declares (types, functions, exported constants, headings).
     */
    List<String> declaredSymbols(Path path, String content);
    
    /**
     * Modules or packages the file references.
     */
    List<String> referencedModules(Path path, String content);
    
    /**
     * Runs every extraction concern. Implementations that parse the file may
     * override this to parse it once.
     */
    default DocumentMetadata extract(Path path, String content) {
        return new DocumentMetadata(
            summary(path, content),
            declaredSymbols(path, content),
            referencedModules(path, content)
        );
    }
}

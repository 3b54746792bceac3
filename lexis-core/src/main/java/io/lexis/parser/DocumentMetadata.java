package io.lexis.parser;

import java.util.List;

/**
 * Metadata extracted from a file's text.
 */
public record DocumentMetadata(String summary, List<String> declaredSymbols, List<String> referencedModules) {
    
    public DocumentMetadata {
        summary = summary != null ? summary : "";
        declaredSymbols = declaredSymbols != null ? List.copyOf(declaredSymbols) : List.of();
        referencedModules = referencedModules != null ? List.copyOf(referencedModules) : List.of();
    }
    
    public static DocumentMetadata empty() {
        return new DocumentMetadata("", List.of(), List.of());
    }
}

package io.lexis;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Which files make up the corpus.
 */
public record CorpusConfig(
    /** Directory that relative paths are computed against */
    Path baseDirectory,
    
    /** Directories (or single files) to scan */
    List<Path> roots,
    
    /** Allowed file extensions, lower case with leading dot */
    Set<String> extensions,
    
    /** Files larger than this are skipped, not truncated */
    long maxFileBytes,
    
    /** Directory names never descended into (hidden directories are always skipped) */
    Set<String> ignoredDirectories
) {
    
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".java", ".ts", ".js", ".md", ".json");
    
    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of("node_modules", "dist", "target", "build", "out");
    
    public static final long DEFAULT_MAX_FILE_BYTES = 100_000;
    
    public CorpusConfig {
        Objects.requireNonNull(baseDirectory, "baseDirectory cannot be null");
        if (maxFileBytes < 0) {
            throw new IllegalArgumentException("maxFileBytes must be >= 0, got " + maxFileBytes);
        }
        baseDirectory = baseDirectory.toAbsolutePath().normalize();
        roots = roots != null
            ? roots.stream().map(root -> root.toAbsolutePath().normalize()).toList()
            : List.of();
        extensions = normalizeExtensions(extensions);
        ignoredDirectories = ignoredDirectories != null ? Set.copyOf(ignoredDirectories) : Set.of();
    }
    
    /**
     * Default corpus: {@code src}, {@code scripts} and {@code docs} under the base directory.
     */
    public static CorpusConfig defaults(Path baseDirectory) {
        return forRoots(baseDirectory, List.of(
            baseDirectory.resolve("src"),
            baseDirectory.resolve("scripts"),
            baseDirectory.resolve("docs")
        ));
    }
    
    /**
     * Default filters over explicit roots.
     */
    public static CorpusConfig forRoots(Path baseDirectory, List<Path> roots) {
        return new CorpusConfig(
            baseDirectory,
            roots,
            DEFAULT_EXTENSIONS,
            DEFAULT_MAX_FILE_BYTES,
            DEFAULT_IGNORED_DIRECTORIES
        );
    }
    
    public CorpusConfig withExtensions(Set<String> extensions) {
        return new CorpusConfig(baseDirectory, roots, extensions, maxFileBytes, ignoredDirectories);
    }
    
    public CorpusConfig withMaxFileBytes(long maxFileBytes) {
        return new CorpusConfig(baseDirectory, roots, extensions, maxFileBytes, ignoredDirectories);
    }
    
    public CorpusConfig withIgnoredDirectories(Set<String> ignoredDirectories) {
        return new CorpusConfig(baseDirectory, roots, extensions, maxFileBytes, ignoredDirectories);
    }
    
    private static Set<String> normalizeExtensions(Set<String> extensions) {
        if (extensions == null) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : extensions) {
            String lower = extension.trim().toLowerCase(Locale.ROOT);
            if (!lower.isEmpty()) {
                normalized.add(lower.startsWith(".") ? lower : "." + lower);
            }
        }
        return Set.copyOf(normalized);
    }
}

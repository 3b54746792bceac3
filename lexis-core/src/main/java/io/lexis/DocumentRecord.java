package io.lexis;

import io.lexis.embeddings.Vectors;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * One indexed file: its location, extracted metadata and TF-IDF embedding.
 * 
 * <p>Only a bounded preview of the file is kept, never the full body.
 * The embedding is copied on the way in and on the way out, so a record
 * handed to callers cannot change the stored vector.</p>
 */
public record DocumentRecord(
    /** Stable identifier derived from the absolute path */
    String id,
    
    /** Absolute path of the file */
    String path,
    
    /** Path relative to the corpus base directory, with forward slashes */
    String relativePath,
    
    /** Label assigned by the topical classifier */
    String topicalTag,
    
    /** Leading characters of the file, used for exact-match highlighting */
    String contentPreview,
    
    /** Short description from the leading doc comment or first lines */
    String summary,
    
    /** Declared types, functions or headings, in order of appearance */
    List<String> declaredSymbols,
    
    /** Imported modules or packages, in order of appearance */
    List<String> referencedModules,
    
    /** Number of lines in the file */
    int lineCount,
    
    /** Last modification time (epoch millis) */
    long lastModified,
    
    /** SHA-256 of the file content, used to detect unchanged files */
    String contentHash,
    
    /** L2-normalized TF-IDF vector (all zeros when no term is in the vocabulary) */
    float[] embedding
) {
    
    /** Length of the hex digest kept as document id */
    public static final int ID_LENGTH = 16;
    
    public DocumentRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(embedding, "embedding cannot be null");
        relativePath = relativePath != null ? relativePath : path;
        topicalTag = topicalTag != null ? topicalTag : "";
        contentPreview = contentPreview != null ? contentPreview : "";
        summary = summary != null ? summary : "";
        declaredSymbols = declaredSymbols != null ? List.copyOf(declaredSymbols) : List.of();
        referencedModules = referencedModules != null ? List.copyOf(referencedModules) : List.of();
        embedding = embedding.clone();
    }
    
    @Override
    public float[] embedding() {
        return embedding.clone();
    }
    
    /**
     * Dot product of this document's embedding with a query vector of the same length.
     */
    public double similarity(float[] queryVector) {
        return Vectors.dot(queryVector, embedding);
    }
    
    /**
     * Derives the document id for a file path. The same path always yields the same id.
     */
    public static String idFor(Path path) {
        return sha256Hex(path.toAbsolutePath().normalize().toString()).substring(0, ID_LENGTH);
    }
    
    /**
     * Digest of a file's text, compared on re-index to skip unchanged files.
     */
    public static String hashContent(String content) {
        return sha256Hex(content);
    }
    
    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentRecord other = (DocumentRecord) o;
        return lineCount == other.lineCount
            && lastModified == other.lastModified
            && id.equals(other.id)
            && path.equals(other.path)
            && relativePath.equals(other.relativePath)
            && topicalTag.equals(other.topicalTag)
            && contentPreview.equals(other.contentPreview)
            && summary.equals(other.summary)
            && declaredSymbols.equals(other.declaredSymbols)
            && referencedModules.equals(other.referencedModules)
            && Objects.equals(contentHash, other.contentHash)
            && Arrays.equals(embedding, other.embedding);
    }
    
    @Override
    public int hashCode() {
        int result = Objects.hash(id, path, relativePath, topicalTag, contentPreview, summary,
            declaredSymbols, referencedModules, lineCount, lastModified, contentHash);
        return 31 * result + Arrays.hashCode(embedding);
    }
    
    @Override
    public String toString() {
        return String.format("DocumentRecord[%s %s (%s)]", id, relativePath, topicalTag);
    }
}

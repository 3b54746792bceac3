package io.lexis;

import io.lexis.embeddings.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Enumerates and reads the files that make up the corpus.
 * 
 * <p>Hidden directories and the configured ignored directories are never
 * entered. Files are kept when their extension is allowed and their size does
 * not exceed the configured maximum; larger files are skipped, not truncated.</p>
 */
public class CorpusWalker {
    
    private static final Logger log = LoggerFactory.getLogger(CorpusWalker.class);
    
    private final CorpusConfig config;
    
    public CorpusWalker(CorpusConfig config) {
        this.config = config;
    }
    
    /**
     * Lists every indexable file under the configured roots, sorted by path
     * and without duplicates. Roots that do not exist are skipped.
     * 
     * @throws IOException if an existing root cannot be read
     */
    public List<Path> walk() throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        
        for (Path root : config.roots()) {
            if (!Files.exists(root)) {
                log.warn("Corpus root does not exist, skipping: {}", root);
                continue;
            }
            if (!Files.isReadable(root)) {
                throw new AccessDeniedException(root.toString(), null, "Corpus root is not readable");
            }
            if (Files.isRegularFile(root)) {
                if (isIndexable(root)) {
                    files.add(root);
                }
                continue;
            }
            
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isExcludedDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }
                
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasAllowedExtension(file)) {
                        if (attrs.size() <= config.maxFileBytes()) {
                            files.add(file.toAbsolutePath().normalize());
                        } else {
                            log.debug("Skipping oversized file ({} bytes): {}", attrs.size(), file);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }
                
                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot access {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        
        log.debug("Found {} files under {} roots", files.size(), config.roots().size());
        return new ArrayList<>(files);
    }
    
    /**
     * Checks whether a single file passes the extension and size filters.
     * Directory exclusions are not applied, so an explicitly named file is
     * accepted wherever it lives.
     */
    public boolean isIndexable(Path file) {
        if (!Files.isRegularFile(file) || !hasAllowedExtension(file)) {
            return false;
        }
        try {
            return Files.size(file) <= config.maxFileBytes();
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", file, e.getMessage());
            return false;
        }
    }
    
    /**
     * Reads and tokenizes a file. Malformed UTF-8 is replaced rather than rejected.
     * 
     * @return the file, or empty when it vanished, grew past the size limit or could not be read
     */
    public Optional<SourceFile> read(Path file, Tokenizer tokenizer) {
        Path absolute = file.toAbsolutePath().normalize();
        try {
            long size = Files.size(absolute);
            if (size > config.maxFileBytes()) {
                log.debug("Skipping oversized file ({} bytes): {}", size, absolute);
                return Optional.empty();
            }
            String content = new String(Files.readAllBytes(absolute), StandardCharsets.UTF_8);
            long lastModified = Files.getLastModifiedTime(absolute).toMillis();
            return Optional.of(new SourceFile(
                absolute,
                relativize(absolute),
                content,
                tokenizer.tokenize(content),
                lastModified
            ));
        } catch (NoSuchFileException e) {
            log.debug("File vanished before it could be read: {}", absolute);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", absolute, e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * Path relative to the base directory with forward slashes, or the
     * absolute path when the file lies outside it.
     */
    public String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(config.baseDirectory())) {
            return absolute.toString().replace('\\', '/');
        }
        return config.baseDirectory().relativize(absolute).toString().replace('\\', '/');
    }
    
    private boolean isExcludedDirectory(Path dir) {
        Path name = dir.getFileName();
        if (name == null) {
            return false;
        }
        String dirName = name.toString();
        return dirName.startsWith(".") || config.ignoredDirectories().contains(dirName);
    }
    
    private boolean hasAllowedExtension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && config.extensions().contains(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }
}

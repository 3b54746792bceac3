package io.lexis.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the index in a single file.
 * 
 * <p>Writes go to a temporary file in the same directory which then replaces
 * the target, so readers never observe a partially written index.</p>
 */
public class FileIndexStorage implements IndexStorage {
    
    private static final Logger log = LoggerFactory.getLogger(FileIndexStorage.class);
    
    private final Path file;
    
    public FileIndexStorage(Path file) {
        this.file = file.toAbsolutePath().normalize();
    }
    
    @Override
    public Optional<byte[]> read() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(file));
    }
    
    @Override
    public void write(byte[] data) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote {} bytes to {}", data.length, file);
    }
    
    @Override
    public String describe() {
        return file.toString();
    }
}

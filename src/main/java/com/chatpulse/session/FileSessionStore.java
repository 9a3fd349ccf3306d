package com.chatpulse.session;

import com.chatpulse.exception.SessionStoreException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each session as {@code <dir>/<name>.session}. Writes go to a temp file first and are
 * moved into place so a crash mid-write never leaves a truncated session behind.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final String SUFFIX = ".session";

    private final Path directory;

    public FileSessionStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public Optional<byte[]> load(String name) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new SessionStoreException("Failed to read session '" + name + "'", e);
        }
    }

    @Override
    public void save(String name, byte[] blob) {
        Path file = resolve(name);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, name, ".tmp");
            Files.write(temp, blob);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Session '{}' saved to {}", name, file);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to write session '" + name + "'", e);
        }
    }

    @Override
    public void delete(String name) {
        try {
            if (Files.deleteIfExists(resolve(name))) {
                log.info("Session '{}' deleted", name);
            }
        } catch (IOException e) {
            throw new SessionStoreException("Failed to delete session '" + name + "'", e);
        }
    }

    @Override
    public void validateName(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new SessionStoreException("Invalid session name '" + name + "': expected " + SAFE_NAME.pattern());
        }
    }

    private Path resolve(String name) {
        validateName(name);
        return directory.resolve(name + SUFFIX);
    }
}

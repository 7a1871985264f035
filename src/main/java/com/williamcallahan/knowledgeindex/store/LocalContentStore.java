package com.williamcallahan.knowledgeindex.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores original document bytes on the local filesystem under {@code <root>/<scope>/<path>}.
 *
 * <p>Paths that would resolve outside the scope directory are rejected.</p>
 */
public class LocalContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(LocalContentStore.class);

    private final Path root;

    public LocalContentStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public void save(String scopeId, String path, byte[] content) throws IOException {
        Path target = resolve(scopeId, path);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Stored {} bytes for scope={} path={}", content.length, scopeId, path);
    }

    @Override
    public InputStream open(String scopeId, String path) throws IOException {
        Path source = resolve(scopeId, path);
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(scopeId + "/" + path);
        }
        return Files.newInputStream(source);
    }

    @Override
    public boolean exists(String scopeId, String path) {
        return Files.isRegularFile(resolve(scopeId, path));
    }

    @Override
    public void delete(String scopeId, String path) throws IOException {
        Files.deleteIfExists(resolve(scopeId, path));
    }

    Path resolve(String scopeId, String path) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path scopeDirectory = root.resolve(scopeId).normalize();
        if (!scopeDirectory.startsWith(root) || scopeDirectory.equals(root)) {
            throw new IllegalArgumentException("Invalid scope id: " + scopeId);
        }
        String relativePath = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = scopeDirectory.resolve(relativePath).normalize();
        if (!resolved.startsWith(scopeDirectory) || resolved.equals(scopeDirectory)) {
            throw new IllegalArgumentException("Path escapes its scope: " + path);
        }
        return resolved;
    }
}

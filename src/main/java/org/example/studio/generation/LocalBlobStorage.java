package org.example.studio.generation;

import jakarta.annotation.PostConstruct;
import org.example.studio.service.CdnAssetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Filesystem-backed storage. Objects are served at {@code /assets/<key>} or, when a CDN base URL
 * is configured, at the CDN URL for the key.
 */
@Service
public class LocalBlobStorage implements BlobStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStorage.class);

    public static final String PUBLIC_PATH = "/assets/";

    private final Path rootDir;
    private final CdnAssetService cdnAssetService;

    public LocalBlobStorage(
            @Value("${storage.root-dir:./data/assets}") String rootDir,
            CdnAssetService cdnAssetService) {
        this.rootDir = Paths.get(rootDir).toAbsolutePath().normalize();
        this.cdnAssetService = cdnAssetService;
    }

    @PostConstruct
    public void init() throws IOException {
        if (!Files.exists(rootDir)) {
            Files.createDirectories(rootDir);
            log.info("Created asset storage directory: {}", rootDir);
        }
    }

    @Override
    public String upload(String key, byte[] bytes) {
        Path target = safeResolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store asset " + key, e);
        }
        log.debug("Stored asset {} ({} bytes)", key, bytes.length);
        return cdnAssetService.buildAssetUrl(key).orElse(PUBLIC_PATH + key);
    }

    @Override
    public Optional<byte[]> read(String ref) {
        return keyFor(ref).flatMap(this::readKey);
    }

    public Optional<byte[]> readKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        Path path = safeResolve(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            log.error("Failed to read asset: {}", key, e);
            return Optional.empty();
        }
    }

    Optional<String> keyFor(String ref) {
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        if (ref.startsWith(PUBLIC_PATH)) {
            return Optional.of(ref.substring(PUBLIC_PATH.length()));
        }
        return cdnAssetService.extractAssetKey(ref);
    }

    private Path safeResolve(String key) {
        Path resolved = rootDir.resolve(key).normalize();
        if (!resolved.startsWith(rootDir)) {
            return rootDir.resolve(Paths.get(key).getFileName().toString());
        }
        return resolved;
    }
}

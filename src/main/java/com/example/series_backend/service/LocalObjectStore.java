package com.example.series_backend.service;

import com.example.series_backend.exception.StorageException;
import com.example.series_backend.service.Interfaces.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Properties;

/**
 * Filesystem-backed {@link ObjectStore}. Each object is written next to a {@code .meta} sidecar
 * holding its content type and metadata.
 */
public class LocalObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectStore.class);
    private static final String META_SUFFIX = ".meta";

    private final Path baseDir;
    private final @Nullable String publicBaseUrl;

    public LocalObjectStore(Path baseDir, @Nullable String publicBaseUrl) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl == null || publicBaseUrl.isBlank()
                ? null
                : publicBaseUrl.replaceAll("/+$", "");
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalObjectStore ready. base={} publicBaseUrl={}", this.baseDir, this.publicBaseUrl);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + this.baseDir, e);
        }
    }

    @Override
    public StoredObject put(String key, byte[] bytes, String contentType, Map<String, String> metadata) {
        if (bytes == null) {
            throw new StorageException("No content for key " + key);
        }
        Path target = safeResolve(key);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            writeMeta(target, contentType, metadata);
        } catch (IOException e) {
            throw new StorageException("Write failed for key " + key, e);
        }
        LOGGER.debug("Stored object key={} bytes={} contentType={}", key, bytes.length, contentType);
        return new StoredObject(key, urlFor(key));
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(safeResolve(key));
    }

    @Override
    public String urlFor(String key) {
        Path p = safeResolve(key);
        if (publicBaseUrl == null) {
            return p.toUri().toString();
        }
        return publicBaseUrl + "/" + normalize(key);
    }

    private void writeMeta(Path target, String contentType, Map<String, String> metadata) throws IOException {
        Properties props = new Properties();
        if (contentType != null) {
            props.setProperty("content-type", contentType);
        }
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) props.setProperty(k, v);
            });
        }
        try (OutputStream out = Files.newOutputStream(target.resolveSibling(target.getFileName() + META_SUFFIX))) {
            props.store(out, null);
        }
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        Path p = baseDir.resolve(normalize(objectKey)).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private static String normalize(String key) {
        // Force forward slashes; strip leading slashes
        return key.replace('\\', '/').replaceAll("^/+", "");
    }
}

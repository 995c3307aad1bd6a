package com.supplier.catalog.storage;

import com.supplier.catalog.core.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Stores assets under a base directory. Keys are paths relative to that directory
 * ({@code media/1718000000000-3f2a9c.jpg}) and URLs are the base URL plus the key.
 */
public class LocalStorageProvider implements StorageProvider {
    private static final Logger log = LoggerFactory.getLogger(LocalStorageProvider.class);

    private final Path baseDirectory;
    private final String baseUrl;

    public LocalStorageProvider(Path baseDirectory, String baseUrl) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String getProviderId() {
        return "local";
    }

    @Override
    public StorageUploadResult upload(byte[] content, StorageUploadOptions options) {
        String contentType = options.contentType() != null ? options.contentType() : MimeTypes.OCTET_STREAM;
        String extension = MimeTypes.extensionFromMimeType(contentType);
        String name = (options.filename() != null ? options.filename() : uniqueName()) + extension;
        String key = options.folder() != null && !options.folder().isBlank()
                ? options.folder() + "/" + name
                : name;

        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Failed to store " + key + ": " + e.getMessage(), e);
        }

        log.debug("storage.uploaded key={} size={} contentType={}", key, content.length, contentType);
        return new StorageUploadResult(key, getUrl(key), content.length, contentType);
    }

    @Override
    public String getUrl(String storageKey) {
        return baseUrl + "/" + storageKey;
    }

    @Override
    public void delete(String storageKey) {
        try {
            Files.deleteIfExists(resolve(storageKey));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + storageKey + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String storageKey) {
        return Files.isRegularFile(resolve(storageKey));
    }

    private Path resolve(String storageKey) {
        Path resolved = baseDirectory.resolve(storageKey).normalize();
        if (!resolved.startsWith(baseDirectory)) {
            throw new StorageException("Storage key escapes the base directory: " + storageKey);
        }
        return resolved;
    }

    private static String uniqueName() {
        return System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

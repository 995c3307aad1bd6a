package com.supplier.catalog.storage;

/**
 * Stores downloaded asset content. Implementations may be a local directory,
 * an object store or a CDN.
 */
public interface StorageProvider {

    /**
     * Identifier recorded on assets stored by this provider, e.g. {@code local}.
     */
    String getProviderId();

    /**
     * @throws com.supplier.catalog.core.exception.StorageException if the content cannot be written
     */
    StorageUploadResult upload(byte[] content, StorageUploadOptions options);

    String getUrl(String storageKey);

    /**
     * Deleting a missing key is not an error.
     */
    void delete(String storageKey);

    boolean exists(String storageKey);
}

package com.supplier.catalog.storage;

/**
 * @param storageKey key to retrieve or delete the content
 * @param url        public URL of the content
 * @param fileSize   size in bytes
 * @param contentType stored MIME type
 */
public record StorageUploadResult(String storageKey, String url, long fileSize, String contentType) {
}

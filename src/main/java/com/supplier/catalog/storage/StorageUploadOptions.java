package com.supplier.catalog.storage;

/**
 * @param folder      sub-folder such as {@code media} or {@code documents}
 * @param filename    base name without extension; a unique name is generated when null
 * @param contentType MIME type of the content
 */
public record StorageUploadOptions(String folder, String filename, String contentType) {

    public StorageUploadOptions {
        if (folder != null && (folder.contains("..") || folder.startsWith("/"))) {
            throw new IllegalArgumentException("folder must be a relative path: " + folder);
        }
        if (filename != null && (filename.contains("/") || filename.contains("\\") || filename.contains(".."))) {
            throw new IllegalArgumentException("filename must not contain path separators: " + filename);
        }
    }

    public static StorageUploadOptions inFolder(String folder, String contentType) {
        return new StorageUploadOptions(folder, null, contentType);
    }
}

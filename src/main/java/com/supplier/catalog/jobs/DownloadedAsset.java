package com.supplier.catalog.jobs;

/**
 * Content fetched by an {@link AssetDownloader}, not yet stored.
 *
 * @param content     raw bytes
 * @param contentType MIME type without parameters
 * @param filename    original file name taken from the URL
 */
public record DownloadedAsset(byte[] content, String contentType, String filename) {

    public long size() {
        return content.length;
    }
}

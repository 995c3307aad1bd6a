package com.supplier.catalog.jobs;

import com.supplier.catalog.core.model.AssetJobType;

/**
 * Fetches remote asset content for one job type.
 */
public interface AssetDownloader {

    AssetJobType getJobType();

    /**
     * Folder the downloaded content is stored in, e.g. {@code media}.
     */
    String getStorageFolder();

    /**
     * @throws com.supplier.catalog.core.exception.AssetDownloadException on invalid URLs, HTTP errors,
     *         timeouts, oversize content or a disallowed content type
     */
    DownloadedAsset download(String sourceUrl);
}

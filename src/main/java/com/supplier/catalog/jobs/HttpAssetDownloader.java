package com.supplier.catalog.jobs;

import com.supplier.catalog.core.exception.AssetDownloadException;
import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.storage.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads assets over HTTP(S) with {@code java.net.http}.
 *
 * <p>Enforces a timeout over the whole download (headers and body), a size cap
 * (checked against Content-Length and again while reading the body) and a MIME
 * allow-list. The document downloader
 * also accepts {@code application/octet-stream} and any {@code text/*} type,
 * since document hosts often mislabel files.</p>
 */
public class HttpAssetDownloader implements AssetDownloader {
    private static final Logger log = LoggerFactory.getLogger(HttpAssetDownloader.class);

    private static final String USER_AGENT = "SupplierCatalog-AssetDownloader/1.0";
    private static final String TIMED_OUT = "Request timed out";
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    // Body reads block on the network; they run here so the caller can stop waiting at the deadline.
    private static final ExecutorService BODY_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "asset-download-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private static final Set<String> MEDIA_TYPES = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/webp", "image/svg+xml",
            "video/mp4", "video/webm");

    private static final Set<String> DOCUMENT_TYPES = Set.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/rtf",
            "application/vnd.oasis.opendocument.text",
            "application/vnd.oasis.opendocument.spreadsheet",
            "text/plain",
            "text/html");

    private final AssetJobType jobType;
    private final String folder;
    private final Duration timeout;
    private final long maxFileSize;
    private final Set<String> allowedMimeTypes;
    private final boolean lenientContentType;
    private final HttpClient httpClient;

    private HttpAssetDownloader(Builder builder) {
        this.jobType = builder.jobType;
        this.folder = builder.folder;
        this.timeout = builder.timeout;
        this.maxFileSize = builder.maxFileSize;
        this.allowedMimeTypes = Set.copyOf(builder.allowedMimeTypes);
        this.lenientContentType = builder.lenientContentType;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
    }

    /**
     * Images and videos: 30 s timeout, 50 MB cap, stored under {@code media}.
     */
    public static HttpAssetDownloader media() {
        return mediaBuilder().build();
    }

    /**
     * Office documents, PDFs and text: 60 s timeout, 100 MB cap, stored under {@code documents}.
     */
    public static HttpAssetDownloader documents() {
        return documentsBuilder().build();
    }

    public static Builder mediaBuilder() {
        return new Builder(AssetJobType.MEDIA_DOWNLOAD, "media")
                .timeout(Duration.ofSeconds(30))
                .maxFileSize(50L * 1024 * 1024)
                .allowedMimeTypes(MEDIA_TYPES);
    }

    public static Builder documentsBuilder() {
        return new Builder(AssetJobType.DOCUMENT_DOWNLOAD, "documents")
                .timeout(Duration.ofSeconds(60))
                .maxFileSize(100L * 1024 * 1024)
                .allowedMimeTypes(DOCUMENT_TYPES)
                .lenientContentType(true);
    }

    @Override
    public AssetJobType getJobType() {
        return jobType;
    }

    @Override
    public String getStorageFolder() {
        return folder;
    }

    @Override
    public DownloadedAsset download(String sourceUrl) {
        URI uri = parseUrl(sourceUrl);
        long deadline = System.nanoTime() + timeout.toNanos();
        log.debug("download.started type={} url={}", jobType, sourceUrl);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new AssetDownloadException(TIMED_OUT, e);
        } catch (IOException e) {
            throw new AssetDownloadException("Download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssetDownloadException("Download interrupted", e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new AssetDownloadException("HTTP error: " + response.statusCode());
            }

            String contentType = MimeTypes.baseType(response.headers().firstValue("Content-Type").orElse(null));
            if (!isAllowed(contentType)) {
                throw new AssetDownloadException("Invalid content type: " + contentType
                        + ". Allowed: " + String.join(", ", allowedMimeTypes.stream().sorted().toList()));
            }

            long declared = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            if (declared > maxFileSize) {
                throw new AssetDownloadException("File too large: " + declared + " bytes (max: " + maxFileSize + " bytes)");
            }

            byte[] content = readBefore(deadline, body, sourceUrl);
            String extension = MimeTypes.extensionFromUrl(sourceUrl);
            if (MimeTypes.OCTET_STREAM.equals(contentType) && !extension.isEmpty()) {
                contentType = MimeTypes.mimeTypeFromExtension(extension);
            }
            String filename = filenameFromUrl(uri, extension.isEmpty() ? MimeTypes.extensionFromMimeType(contentType) : extension);

            log.info("download.completed type={} url={} size={} contentType={}", jobType, sourceUrl,
                    content.length, contentType);
            return new DownloadedAsset(content, contentType, filename);
        } catch (IOException e) {
            throw new AssetDownloadException("Download failed: " + e.getMessage(), e);
        }
    }

    private boolean isAllowed(String contentType) {
        if (allowedMimeTypes.contains(contentType)) {
            return true;
        }
        return lenientContentType && (MimeTypes.OCTET_STREAM.equals(contentType) || contentType.startsWith("text/"));
    }

    private byte[] readBefore(long deadline, InputStream body, String sourceUrl) {
        Future<byte[]> future = BODY_READERS.submit(() -> readCapped(body));
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("download.timeout type={} url={} timeout={}", jobType, sourceUrl, timeout);
            throw new AssetDownloadException(TIMED_OUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AssetDownloadException downloadException) {
                throw downloadException;
            }
            throw new AssetDownloadException("Download failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AssetDownloadException("Download interrupted", e);
        }
    }

    private byte[] readCapped(InputStream body) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            total += read;
            if (total > maxFileSize) {
                throw new AssetDownloadException("File too large: more than " + maxFileSize + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private static URI parseUrl(String sourceUrl) {
        try {
            URI uri = URI.create(sourceUrl);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new AssetDownloadException("Invalid URL: " + sourceUrl);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new AssetDownloadException("Invalid URL: " + sourceUrl, e);
        }
    }

    private static String filenameFromUrl(URI uri, String fallbackExtension) {
        String path = uri.getPath();
        if (path != null) {
            String last = path.substring(path.lastIndexOf('/') + 1);
            if (!last.isBlank()) {
                return last;
            }
        }
        return "download" + (fallbackExtension.isEmpty() ? ".bin" : fallbackExtension);
    }

    public static class Builder {
        private final AssetJobType jobType;
        private final String folder;
        private Duration timeout;
        private long maxFileSize;
        private Set<String> allowedMimeTypes = Set.of();
        private boolean lenientContentType;
        private HttpClient httpClient;

        private Builder(AssetJobType jobType, String folder) {
            this.jobType = jobType;
            this.folder = folder;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxFileSize(long maxFileSize) {
            if (maxFileSize <= 0) {
                throw new IllegalArgumentException("maxFileSize must be > 0");
            }
            this.maxFileSize = maxFileSize;
            return this;
        }

        public Builder allowedMimeTypes(Set<String> allowedMimeTypes) {
            this.allowedMimeTypes = allowedMimeTypes;
            return this;
        }

        public Builder lenientContentType(boolean lenientContentType) {
            this.lenientContentType = lenientContentType;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpAssetDownloader build() {
            return new HttpAssetDownloader(this);
        }
    }
}

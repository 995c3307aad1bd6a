package com.supplier.catalog.storage;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File extension and MIME type lookups for stored assets.
 */
public final class MimeTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Pattern EXTENSION = Pattern.compile("\\.([a-zA-Z0-9]+)$");

    private static final Map<String, String> EXTENSION_BY_MIME = Map.ofEntries(
            Map.entry("image/jpeg", ".jpg"),
            Map.entry("image/png", ".png"),
            Map.entry("image/gif", ".gif"),
            Map.entry("image/webp", ".webp"),
            Map.entry("image/svg+xml", ".svg"),
            Map.entry("video/mp4", ".mp4"),
            Map.entry("video/webm", ".webm"),
            Map.entry("application/pdf", ".pdf"),
            Map.entry("application/msword", ".doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ".docx"),
            Map.entry("application/vnd.ms-excel", ".xls"),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ".xlsx"),
            Map.entry("application/rtf", ".rtf"),
            Map.entry("text/plain", ".txt"),
            Map.entry("text/html", ".html")
    );

    private MimeTypes() {
        // Utility class
    }

    /**
     * Lowercased extension with the leading dot, or "" when the URL path has none.
     */
    public static String extensionFromUrl(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null) {
            return "";
        }
        Matcher m = EXTENSION.matcher(path);
        return m.find() ? "." + m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    public static String extensionFromMimeType(String mimeType) {
        return mimeType == null ? "" : EXTENSION_BY_MIME.getOrDefault(mimeType, "");
    }

    public static String mimeTypeFromExtension(String extension) {
        String wanted = extension.toLowerCase(Locale.ROOT);
        if (".jpeg".equals(wanted)) {
            return "image/jpeg";
        }
        return EXTENSION_BY_MIME.entrySet().stream()
                .filter(e -> e.getValue().equals(wanted))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(OCTET_STREAM);
    }

    /**
     * Strips parameters: {@code "text/html; charset=utf-8"} becomes {@code "text/html"}.
     */
    public static String baseType(String contentTypeHeader) {
        if (contentTypeHeader == null || contentTypeHeader.isBlank()) {
            return OCTET_STREAM;
        }
        return contentTypeHeader.split(";")[0].trim().toLowerCase(Locale.ROOT);
    }
}

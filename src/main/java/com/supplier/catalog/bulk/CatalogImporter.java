package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.core.exception.CatalogImportException;
import com.supplier.catalog.core.exception.CatalogParseException;
import com.supplier.catalog.core.exception.InvalidRowException;
import com.supplier.catalog.core.exception.NoMatchException;
import com.supplier.catalog.core.model.CatalogUpload;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.UploadStatus;
import com.supplier.catalog.decision.Decision;
import com.supplier.catalog.decision.DecisionPolicy;
import com.supplier.catalog.decision.ImportAction;
import com.supplier.catalog.enrichment.EnrichmentOutcome;
import com.supplier.catalog.enrichment.EnrichmentTrigger;
import com.supplier.catalog.logging.LogContext;
import com.supplier.catalog.matching.MatchResult;
import com.supplier.catalog.matching.ProductMatcher;
import com.supplier.catalog.metrics.MetricsService;
import com.supplier.catalog.persistence.CatalogUploadRepository;
import com.supplier.catalog.writer.CatalogWriter;
import com.supplier.catalog.writer.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a supplier catalog import: parse, match, decide, write and enrich, row by row.
 *
 * <p>Every run is audited by a {@link CatalogUpload} that moves
 * RECEIVED, PROCESSING, then COMPLETED or FAILED. A row that fails with a
 * {@link CatalogImportException} is reported and the run continues. Any other
 * exception aborts the remaining rows and fails the run; rows already written
 * stay written and are part of the returned result.</p>
 */
public class CatalogImporter {
    private static final Logger log = LoggerFactory.getLogger(CatalogImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    static final String NO_MATCH_ERROR = "No matching product found and product creation is disabled";

    private final CatalogUploadRepository uploads;
    private final CsvCatalogParser parser;
    private final ProductMatcher matcher;
    private final CatalogWriter writer;
    private final EnrichmentTrigger enrichmentTrigger;
    private final MetricsService metrics;

    /**
     * @param enrichmentTrigger may be null, in which case rows are never enriched
     */
    public CatalogImporter(CatalogUploadRepository uploads,
                           CsvCatalogParser parser,
                           ProductMatcher matcher,
                           CatalogWriter writer,
                           EnrichmentTrigger enrichmentTrigger,
                           MetricsService metrics) {
        this.uploads = uploads;
        this.parser = parser;
        this.matcher = matcher;
        this.writer = writer;
        this.enrichmentTrigger = enrichmentTrigger;
        this.metrics = metrics;
    }

    public ImportResult importCatalog(String globalSupplierId, String filename, String rawContent,
                                      ImportOptions options, String uploadedBy) {
        return importCatalog(globalSupplierId, filename, rawContent, options, uploadedBy, ProgressCallback.NOOP);
    }

    /**
     * Imports a catalog file. The raw content is stored unchanged on the upload record.
     */
    public ImportResult importCatalog(String globalSupplierId, String filename, String rawContent,
                                      ImportOptions options, String uploadedBy, ProgressCallback callback) {
        requireSupplier(globalSupplierId);
        CatalogUpload upload = uploads.save(CatalogUpload.builder()
                .globalSupplierId(globalSupplierId)
                .filename(filename)
                .rawContent(rawContent)
                .uploadedBy(uploadedBy)
                .build());
        return run(upload, () -> parser.parse(rawContent, options), options, callback);
    }

    public ImportResult importCatalog(String globalSupplierId, List<ImportRow> rows, ImportOptions options) {
        return importCatalog(globalSupplierId, rows, options, ProgressCallback.NOOP);
    }

    /**
     * Imports rows parsed elsewhere, such as from an integration feed. The rows get the
     * same defaults and corrections as parsed text.
     */
    public ImportResult importCatalog(String globalSupplierId, List<ImportRow> rows, ImportOptions options,
                                      ProgressCallback callback) {
        requireSupplier(globalSupplierId);
        CatalogUpload upload = uploads.save(CatalogUpload.builder()
                .globalSupplierId(globalSupplierId)
                .build());
        return run(upload, () -> new ParseResult(rows.stream()
                .map(row -> ImportRowNormalizer.normalize(row, options))
                .toList(), List.of()), options, callback);
    }

    private ImportResult run(CatalogUpload upload, Supplier<ParseResult> source, ImportOptions options,
                             ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String supplierId = upload.getGlobalSupplierId();
        Instant startedAt = Instant.now();

        List<RowResult> results = new ArrayList<>();
        int total = 0;
        UploadStatus finalStatus = UploadStatus.FAILED;
        String errorMessage = null;

        try (LogContext ctx = LogContext.forImport(upload.getId(), supplierId)) {
            try {
                ParseResult parsed = source.get();
                total = parsed.rowCount();
                upload.startProcessing(total);
                uploads.save(upload);
                log.info("import.started uploadId={} supplier={} rows={}", upload.getId(), supplierId, total);

                List<ImportRow> rows = parsed.rows();
                List<RowError> rejected = parsed.rejected();
                int nextRow = 0;
                int nextRejected = 0;
                for (int index = 0; index < total; index++) {
                    boolean takeRejected = nextRejected < rejected.size()
                            && (nextRow >= rows.size()
                            || rejected.get(nextRejected).lineNumber() < rows.get(nextRow).lineNumber());
                    if (takeRejected) {
                        RowError error = rejected.get(nextRejected++);
                        results.add(RowResult.failed(index, error.lineNumber(), error.message(), List.of()));
                        metrics.incrementRowFailed();
                    } else {
                        ImportRow row = rows.get(nextRow++);
                        try {
                            results.add(processRow(new RowContext(upload.getId(), supplierId, index, options), row));
                        } catch (RuntimeException e) {
                            results.add(RowResult.failed(index, row.lineNumber(),
                                    "Processing error: " + e.getMessage(), row.warnings()));
                            metrics.incrementRowFailed();
                            throw e;
                        }
                    }

                    if ((index + 1) % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(index + 1, total, "Processed " + (index + 1) + " rows");
                    }
                }
                finalStatus = UploadStatus.COMPLETED;
            } catch (CatalogParseException e) {
                errorMessage = e.getMessage();
                log.warn("import.rejected uploadId={} error={}", upload.getId(), errorMessage);
            } catch (RuntimeException e) {
                errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                log.error("import.aborted uploadId={} processedRows={} error={}", upload.getId(),
                        results.size(), errorMessage, e);
            } finally {
                int success = 0;
                int failed = 0;
                int review = 0;
                int enriched = 0;
                for (RowResult row : results) {
                    if (row.success()) {
                        success++;
                        if (row.needsReview()) {
                            review++;
                        }
                        if (row.enriched()) {
                            enriched++;
                        }
                    } else {
                        failed++;
                    }
                }
                upload.complete(finalStatus, success, failed, review, enriched, errorMessage);
                uploads.save(upload);
                metrics.recordImportDuration(finalStatus, Duration.between(startedAt, Instant.now()));
            }
        }

        ImportResult result = new ImportResult(upload.getId(), supplierId, upload.getStatus(), total,
                upload.getSuccessCount(), upload.getFailedCount(), upload.getReviewCount(),
                upload.getEnrichedCount(), upload.getErrorMessage(), startedAt, upload.getCompletedAt(), results);
        cb.onProgress(results.size(), total, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    private RowResult processRow(RowContext context, ImportRow row) {
        String supplierId = context.globalSupplierId();
        ImportOptions options = context.options();
        List<String> warnings = new ArrayList<>(row.warnings());
        try {
            if (!row.hasGtin() && !row.hasSku() && row.name().codePoints().noneMatch(Character::isLetterOrDigit)) {
                throw new InvalidRowException("Row has no usable name, SKU or GTIN");
            }
            MatchResult match = matcher.match(row, supplierId);
            Decision decision = DecisionPolicy.decide(match, options.getMinAutoMatchConfidence(),
                    options.isCreateNewProducts());

            WriteResult write;
            MatchMethod method;
            double confidence;
            if (decision.action() == ImportAction.REJECT) {
                throw new NoMatchException(NO_MATCH_ERROR);
            } else if (decision.action() == ImportAction.CREATE_NEW) {
                write = writer.createProductAndItem(supplierId, row);
                method = MatchMethod.NONE;
                confidence = 1.0;
            } else {
                write = writer.linkToProduct(supplierId, row, match, decision.needsReview());
                method = match.method();
                confidence = match.confidence();
                metrics.recordMatchConfidence(confidence);
            }
            metrics.incrementRowImported(method, decision.needsReview());

            boolean enriched = false;
            if (options.isAutoEnrich() && enrichmentTrigger != null && write.productHasGtin()) {
                EnrichmentOutcome outcome = enrichmentTrigger.enrich(write.productId());
                enriched = outcome.enriched();
                warnings.addAll(outcome.warnings());
            }

            log.debug("import.row line={} action={} method={} confidence={} productId={}", row.lineNumber(),
                    decision.action(), method, confidence, write.productId());
            return new RowResult(context.rowIndex(), row.lineNumber(), true, write.productId(), write.supplierItemId(),
                    method, confidence, decision.needsReview(), enriched, List.of(), warnings);
        } catch (CatalogImportException e) {
            metrics.incrementRowFailed();
            log.warn("import.row.failed uploadId={} line={} name='{}' error={}", context.uploadId(),
                    row.lineNumber(), row.name(), e.getMessage());
            return RowResult.failed(context.rowIndex(), row.lineNumber(), e.getMessage(), warnings);
        }
    }

    private static void requireSupplier(String globalSupplierId) {
        if (globalSupplierId == null || globalSupplierId.isBlank()) {
            throw new IllegalArgumentException("globalSupplierId is required");
        }
    }
}

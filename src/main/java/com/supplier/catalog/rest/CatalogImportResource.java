package com.supplier.catalog.rest;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.api.SupplierCatalogPipeline;
import com.supplier.catalog.bulk.ImportResult;
import com.supplier.catalog.core.model.CatalogUpload;
import com.supplier.catalog.rest.dto.CatalogImportRequest;
import com.supplier.catalog.rest.dto.CatalogUploadResponse;
import com.supplier.catalog.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * REST resource for importing supplier catalogs and reading back import runs.
 */
@Path("/api/v1/catalog-imports")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Catalog Import", description = "Supplier catalog upload, parsing and product matching")
public class CatalogImportResource {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportResource.class);
    private static final String BASE_PATH = "/api/v1/catalog-imports";

    private final SupplierCatalogPipeline pipeline;

    @Inject
    public CatalogImportResource(SupplierCatalogPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Imports a catalog file synchronously and returns per-row results.
     *
     * POST /api/v1/catalog-imports
     */
    @POST
    @Operation(summary = "Import catalog", description = "Parses the catalog content, matches every row to a product " +
            "and records the run. Rows that fail do not abort the import.")
    @APIResponse(responseCode = "200", description = "Import finished, possibly with failed rows")
    @APIResponse(responseCode = "400", description = "Invalid request")
    public Response importCatalog(CatalogImportRequest request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("Request body is required", BASE_PATH))
                    .build();
        }
        try {
            ImportOptions options = request.toOptions(pipeline.getDefaultOptions());
            ImportResult result = pipeline.importCatalog(
                    request.globalSupplierId(), request.filename(), request.content(), request.uploadedBy(), options);
            log.info("importCatalog.completed uploadId={} status={}", result.uploadId(), result.status());
            return Response.ok(result).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH, log);
        }
    }

    /**
     * Gets the audit record of one import run.
     *
     * GET /api/v1/catalog-imports/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get import run", description = "Retrieves the status and counts of an import run.")
    @APIResponse(responseCode = "200", description = "Import run found")
    @APIResponse(responseCode = "404", description = "Import run not found")
    public Response getUpload(@Parameter(description = "Upload ID") @PathParam("id") String uploadId) {
        String path = BASE_PATH + "/" + uploadId;
        try {
            Optional<CatalogUpload> upload = pipeline.getUpload(uploadId);
            if (upload.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("Upload not found: " + uploadId, path))
                        .build();
            }
            return Response.ok(CatalogUploadResponse.from(upload.get())).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    /**
     * Lists the most recent import runs.
     *
     * GET /api/v1/catalog-imports?limit=20
     */
    @GET
    @Operation(summary = "List recent import runs")
    public Response getRecentUploads(@QueryParam("limit") @DefaultValue("20") int limit) {
        try {
            List<CatalogUploadResponse> uploads = pipeline.getRecentUploads(limit).stream()
                    .map(CatalogUploadResponse::from)
                    .toList();
            return Response.ok(uploads).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH, log);
        }
    }
}

package com.supplier.catalog.rest;

import com.supplier.catalog.jobs.AssetJobQueue;
import com.supplier.catalog.jobs.AssetJobResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * REST resource for driving the asset download queue. Meant to be called by a scheduler.
 */
@Path("/api/v1/asset-jobs")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Asset Jobs", description = "Background download of product media and documents")
public class AssetJobResource {
    private static final Logger log = LoggerFactory.getLogger(AssetJobResource.class);
    private static final String BASE_PATH = "/api/v1/asset-jobs";

    private final AssetJobQueue queue;

    @Inject
    public AssetJobResource(AssetJobQueue queue) {
        this.queue = queue;
    }

    /**
     * POST /api/v1/asset-jobs/process?batchSize=10
     */
    @POST
    @Path("/process")
    @Operation(summary = "Process a batch", description = "Downloads and stores up to batchSize pending or retryable jobs.")
    public Response processBatch(
            @Parameter(description = "Maximum jobs to process") @QueryParam("batchSize") Integer batchSize) {
        String path = BASE_PATH + "/process";
        try {
            AssetJobResult result = batchSize != null ? queue.processBatch(batchSize) : queue.processBatch();
            return Response.ok(result).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    /**
     * POST /api/v1/asset-jobs/release-stale
     */
    @POST
    @Path("/release-stale")
    @Operation(summary = "Release stale jobs", description = "Fails jobs stuck in PROCESSING past their lease so they can be retried.")
    public Response releaseStale() {
        try {
            return Response.ok(Map.of("released", queue.releaseStaleJobs())).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH + "/release-stale", log);
        }
    }

    @GET
    @Path("/stats")
    @Operation(summary = "Job counts by status")
    public Response stats() {
        try {
            return Response.ok(queue.stats()).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH + "/stats", log);
        }
    }

    /**
     * DELETE /api/v1/asset-jobs/completed?daysOld=7
     */
    @DELETE
    @Path("/completed")
    @Operation(summary = "Delete completed jobs", description = "Removes completed jobs older than daysOld days.")
    public Response cleanup(
            @Parameter(description = "Retention in days") @QueryParam("daysOld") Integer daysOld) {
        String path = BASE_PATH + "/completed";
        try {
            int deleted = daysOld != null ? queue.cleanup(daysOld) : queue.cleanup();
            return Response.ok(Map.of("deleted", deleted)).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }
}

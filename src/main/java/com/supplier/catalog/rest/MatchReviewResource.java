package com.supplier.catalog.rest;

import com.supplier.catalog.api.Page;
import com.supplier.catalog.api.PageRequest;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.rest.dto.ChangeProductRequest;
import com.supplier.catalog.rest.dto.CreateProductRequest;
import com.supplier.catalog.rest.dto.ErrorResponse;
import com.supplier.catalog.rest.dto.ReviewActionRequest;
import com.supplier.catalog.rest.dto.SupplierItemResponse;
import com.supplier.catalog.review.ReviewService;
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

import java.util.Map;

/**
 * REST resource for the match review queue.
 *
 * <p>Every action names the acting user, which is written to the item and the audit log.</p>
 */
@Path("/api/v1/match-reviews")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Match Review", description = "Supplier items whose product link needs a human decision")
public class MatchReviewResource {
    private static final Logger log = LoggerFactory.getLogger(MatchReviewResource.class);
    private static final String BASE_PATH = "/api/v1/match-reviews";

    private final ReviewService reviewService;

    @Inject
    public MatchReviewResource(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    /**
     * GET /api/v1/match-reviews?page=0&size=20
     */
    @GET
    @Operation(summary = "List pending reviews", description = "Returns supplier items flagged for review, oldest first.")
    public Response getPendingReviews(
            @QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("20") int size) {
        try {
            Page<SupplierItem> items = reviewService.getPendingReviews(PageRequest.of(page, size));
            Page<SupplierItemResponse> result = new Page<>(
                    items.content().stream().map(SupplierItemResponse::from).toList(),
                    items.totalElements(), items.pageNumber(), items.pageSize());
            return Response.ok(result).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH, log);
        }
    }

    @GET
    @Path("/count")
    @Operation(summary = "Count pending reviews")
    public Response getPendingCount() {
        try {
            return Response.ok(Map.of("pendingCount", reviewService.countPending())).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, BASE_PATH + "/count", log);
        }
    }

    /**
     * Accepts the current product link.
     *
     * POST /api/v1/match-reviews/{id}/confirm
     */
    @POST
    @Path("/{id}/confirm")
    @Operation(summary = "Confirm match", description = "Accepts the current product link and clears the review flag.")
    @APIResponse(responseCode = "200", description = "Match confirmed")
    @APIResponse(responseCode = "404", description = "Supplier item not found")
    @APIResponse(responseCode = "409", description = "Supplier item is ignored")
    public Response confirm(@Parameter(description = "Supplier item ID") @PathParam("id") String itemId,
                            ReviewActionRequest request) {
        String path = BASE_PATH + "/" + itemId + "/confirm";
        if (request == null) {
            return missingBody(path);
        }
        try {
            SupplierItem item = reviewService.confirmMatch(itemId, request.actor());
            return Response.ok(SupplierItemResponse.from(item)).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    /**
     * Re-links the item to another existing product.
     *
     * POST /api/v1/match-reviews/{id}/change-product
     */
    @POST
    @Path("/{id}/change-product")
    @Operation(summary = "Change product", description = "Links the supplier item to a different existing product.")
    @APIResponse(responseCode = "200", description = "Supplier item re-linked")
    @APIResponse(responseCode = "404", description = "Supplier item or product not found")
    @APIResponse(responseCode = "409", description = "Supplier already has an item for that product")
    public Response changeProduct(@Parameter(description = "Supplier item ID") @PathParam("id") String itemId,
                                  ChangeProductRequest request) {
        String path = BASE_PATH + "/" + itemId + "/change-product";
        if (request == null) {
            return missingBody(path);
        }
        try {
            SupplierItem item = reviewService.changeProduct(itemId, request.productId(), request.actor());
            return Response.ok(SupplierItemResponse.from(item)).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    /**
     * Creates a new product and links the item to it.
     *
     * POST /api/v1/match-reviews/{id}/create-product
     */
    @POST
    @Path("/{id}/create-product")
    @Operation(summary = "Create product and link", description = "Creates a canonical product from the given data " +
            "and links the supplier item to it.")
    @APIResponse(responseCode = "200", description = "Product created and linked")
    @APIResponse(responseCode = "400", description = "Invalid product data")
    @APIResponse(responseCode = "409", description = "GTIN already in use")
    public Response createProduct(@Parameter(description = "Supplier item ID") @PathParam("id") String itemId,
                                  CreateProductRequest request) {
        String path = BASE_PATH + "/" + itemId + "/create-product";
        if (request == null) {
            return missingBody(path);
        }
        try {
            SupplierItem item = reviewService.createProductAndLink(itemId, request.toProductData(), request.actor());
            return Response.ok(SupplierItemResponse.from(item)).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    /**
     * Marks the item as ignored. Ignored items are kept but leave the review queue.
     *
     * POST /api/v1/match-reviews/{id}/ignore
     */
    @POST
    @Path("/{id}/ignore")
    @Operation(summary = "Ignore supplier item")
    @APIResponse(responseCode = "200", description = "Supplier item ignored")
    @APIResponse(responseCode = "404", description = "Supplier item not found")
    public Response ignore(@Parameter(description = "Supplier item ID") @PathParam("id") String itemId,
                           ReviewActionRequest request) {
        String path = BASE_PATH + "/" + itemId + "/ignore";
        if (request == null) {
            return missingBody(path);
        }
        try {
            SupplierItem item = reviewService.markIgnored(itemId, request.actor());
            return Response.ok(SupplierItemResponse.from(item)).build();
        } catch (RuntimeException e) {
            return ErrorResponses.from(e, path, log);
        }
    }

    private static Response missingBody(String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest("Request body is required", path))
                .build();
    }
}

package com.supplier.catalog.rest;

import com.supplier.catalog.core.exception.DuplicateGtinException;
import com.supplier.catalog.core.exception.DuplicateSupplierItemException;
import com.supplier.catalog.core.exception.RecordNotFoundException;
import com.supplier.catalog.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;

/**
 * Maps service exceptions to error responses: unknown records to 404, duplicates and
 * invalid state to 409, invalid input to 400, anything else to 500.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static Response from(RuntimeException e, String path, Logger log) {
        if (e instanceof RecordNotFoundException) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(e.getMessage(), path))
                    .build();
        }
        if (e instanceof DuplicateSupplierItemException
                || e instanceof DuplicateGtinException
                || e instanceof IllegalStateException) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path))
                    .build();
        }
        if (e instanceof IllegalArgumentException) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
        log.error("request.failed path={} error={}", path, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(e.getMessage(), path))
                .build();
    }
}

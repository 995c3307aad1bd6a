package com.supplier.catalog.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Supplier Catalog API",
                version = "1.0.0",
                description = "Imports supplier price catalogs, links each line to a canonical product " +
                        "by GTIN, SKU or fuzzy name, exposes uncertain links for manual review and " +
                        "downloads product media and documents in the background.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class SupplierCatalogApplication extends Application {
}

package com.supplier.catalog.core.model;

/**
 * Media (images, video) or document (leaflets, safety sheets) attached to a product.
 */
public enum AssetKind {
    MEDIA,
    DOCUMENT
}

package com.hhplus.checkout.domain.catalog;

public enum ProductStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED
}

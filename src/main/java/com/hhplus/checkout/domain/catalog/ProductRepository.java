package com.hhplus.checkout.domain.catalog;

import java.util.Optional;

/**
 * ProductRepository - Domain 계층 (Port)
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    Optional<ProductVariant> findVariantById(Long variantId);

    Product save(Product product);

    ProductVariant saveVariant(ProductVariant variant);
}

package com.hhplus.checkout.infrastructure.persistence.catalog;

import com.hhplus.checkout.domain.catalog.Product;
import com.hhplus.checkout.domain.catalog.ProductRepository;
import com.hhplus.checkout.domain.catalog.ProductVariant;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;
    private final ProductVariantJpaRepository productVariantJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository,
                                  ProductVariantJpaRepository productVariantJpaRepository) {
        this.productJpaRepository = productJpaRepository;
        this.productVariantJpaRepository = productVariantJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public Optional<ProductVariant> findVariantById(Long variantId) {
        return productVariantJpaRepository.findById(variantId);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public ProductVariant saveVariant(ProductVariant variant) {
        return productVariantJpaRepository.save(variant);
    }
}

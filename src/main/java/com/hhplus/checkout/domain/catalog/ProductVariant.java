package com.hhplus.checkout.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "product_variants")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductVariant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "variant_id")
    private Long variantId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    // null이면 상품 가격을 따름
    @Column(name = "price")
    private Long price;

    @Column(name = "stock")
    private Integer stock;

    public boolean belongsTo(Long productId) {
        return this.productId != null && this.productId.equals(productId);
    }
}

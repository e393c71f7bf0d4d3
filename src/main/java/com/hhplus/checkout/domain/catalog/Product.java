package com.hhplus.checkout.domain.catalog;

import com.hhplus.checkout.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Product 엔티티 (카탈로그 읽기 모델)
 *
 * 상품 관리(CRUD)는 외부 관리 콘솔이 담당하며, 결제 엔진은 판매 상태와 가격만 읽습니다.
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private ProductStatus status;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "sale_price")
    private Long salePrice;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "track_stock", nullable = false)
    private boolean trackStock;

    @Column(name = "stock")
    private Integer stock;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return this.status == ProductStatus.ACTIVE;
    }

    /**
     * 실제 판매 단가: 옵션 가격 → 상품 할인가 → 상품 정가 순으로 적용
     */
    public Money effectivePrice(ProductVariant variant) {
        if (variant != null && variant.getPrice() != null) {
            return Money.ofMinor(variant.getPrice(), currency);
        }
        if (salePrice != null) {
            return Money.ofMinor(salePrice, currency);
        }
        return Money.ofMinor(price, currency);
    }

    /**
     * 재고를 추적하는 상품이면 요청 수량만큼 남아 있는지 확인합니다.
     * 옵션이 있으면 옵션 재고를 기준으로 합니다.
     */
    public boolean hasStockFor(ProductVariant variant, int quantity) {
        if (!trackStock) {
            return true;
        }
        Integer available = (variant != null && variant.getStock() != null) ? variant.getStock() : stock;
        return available != null && available >= quantity;
    }
}

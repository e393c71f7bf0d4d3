package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * OrderItem 도메인 엔티티
 *
 * 주문 시점의 단가와 상품명을 스냅샷으로 보관합니다.
 * lineTotal = unitPrice × quantity
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "item_type", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private OrderItemType itemType;

    @Column(name = "product_id")
    private Long productId;

    @Column(name = "variant_id")
    private Long variantId;

    @Column(name = "course_id")
    private Long courseId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "unit_price", nullable = false)
    private Long unitPriceAmount;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "line_total", nullable = false)
    private Long lineTotalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static OrderItem ofProduct(Long productId, Long variantId, String name, Money unitPrice, int quantity) {
        if (productId == null) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        return create(OrderItemType.PRODUCT, productId, variantId, null, name, unitPrice, quantity);
    }

    public static OrderItem ofCourse(Long courseId, String name, Money price) {
        if (courseId == null) {
            throw new IllegalArgumentException("강의 ID는 필수입니다");
        }
        return create(OrderItemType.COURSE, null, null, courseId, name, price, 1);
    }

    private static OrderItem create(OrderItemType type, Long productId, Long variantId, Long courseId,
                                    String name, Money unitPrice, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("주문 수량은 1 이상이어야 합니다");
        }
        Money lineTotal = unitPrice.multiply(quantity);
        return OrderItem.builder()
                .itemType(type)
                .productId(productId)
                .variantId(variantId)
                .courseId(courseId)
                .name(name)
                .unitPriceAmount(unitPrice.getAmount())
                .quantity(quantity)
                .lineTotalAmount(lineTotal.getAmount())
                .currency(unitPrice.getCurrency())
                .createdAt(LocalDateTime.now())
                .build();
    }

    public Money getUnitPrice() {
        return Money.ofMinor(unitPriceAmount, currency);
    }

    public Money getLineTotal() {
        return Money.ofMinor(lineTotalAmount, currency);
    }

    public boolean isCourse() {
        return itemType == OrderItemType.COURSE;
    }
}

package com.hhplus.checkout.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 *
 * item_key는 (상품, 옵션) 또는 강의를 나타내는 정규화된 키이며,
 * (cart_id, item_key) 유니크 제약으로 같은 조합의 항목이 두 줄 생기지 않습니다.
 * 옵션이 없는 상품은 NULL 비교 문제를 피하기 위해 옵션 자리에 0을 씁니다.
 *
 * - 상품: "P:{productId}:{variantId|0}"
 * - 강의: "C:{courseId}"
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
    @UniqueConstraint(name = "uk_cart_item_key", columnNames = {"cart_id", "item_key"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "item_type", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private CartItemType itemType;

    @Column(name = "item_key", nullable = false, length = 64)
    private String itemKey;

    @Column(name = "product_id")
    private Long productId;

    @Column(name = "variant_id")
    private Long variantId;

    @Column(name = "course_id")
    private Long courseId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static String productKey(Long productId, Long variantId) {
        return "P:" + productId + ":" + (variantId == null ? 0 : variantId);
    }

    public static String courseKey(Long courseId) {
        return "C:" + courseId;
    }

    public static CartItem product(Long cartId, Long productId, Long variantId, int quantity) {
        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .cartId(cartId)
                .itemType(CartItemType.PRODUCT)
                .itemKey(productKey(productId, variantId))
                .productId(productId)
                .variantId(variantId)
                .quantity(quantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static CartItem course(Long cartId, Long courseId) {
        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .cartId(cartId)
                .itemType(CartItemType.COURSE)
                .itemKey(courseKey(courseId))
                .courseId(courseId)
                .quantity(CartConstants.COURSE_QUANTITY)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isCourse() {
        return itemType == CartItemType.COURSE;
    }

    public void changeQuantity(int quantity) {
        this.quantity = quantity;
        this.updatedAt = LocalDateTime.now();
    }
}

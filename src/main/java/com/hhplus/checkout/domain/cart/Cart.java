package com.hhplus.checkout.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Cart 도메인 엔티티
 *
 * 사용자 ID 또는 세션 토큰 중 하나에 묶이며, 각각 유니크 제약을 가집니다.
 * 첫 조회 시 지연 생성됩니다. 합계는 저장하지 않고 조회할 때마다 다시 계산합니다.
 */
@Entity
@Table(name = "carts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_cart_user", columnNames = {"user_id"}),
    @UniqueConstraint(name = "uk_cart_session", columnNames = {"session_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart createFor(CartOwner owner) {
        LocalDateTime now = LocalDateTime.now();
        return Cart.builder()
                .userId(owner.getUserId())
                .sessionId(owner.getSessionId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isOwnedBy(CartOwner owner) {
        if (owner.isUser()) {
            return owner.getUserId().equals(userId);
        }
        return owner.getSessionId().equals(sessionId);
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}

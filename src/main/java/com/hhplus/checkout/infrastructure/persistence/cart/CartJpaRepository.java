package com.hhplus.checkout.infrastructure.persistence.cart;

import com.hhplus.checkout.domain.cart.Cart;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Cart JPA Repository
 * Spring Data JPA를 통한 Cart 엔티티 영구 저장소
 */
public interface CartJpaRepository extends JpaRepository<Cart, Long> {

    Optional<Cart> findByUserId(Long userId);

    Optional<Cart> findBySessionId(String sessionId);
}

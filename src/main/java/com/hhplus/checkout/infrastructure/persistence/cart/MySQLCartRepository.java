package com.hhplus.checkout.infrastructure.persistence.cart;

import com.hhplus.checkout.domain.cart.Cart;
import com.hhplus.checkout.domain.cart.CartItem;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(CartRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository, CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Optional<Cart> findByOwner(CartOwner owner) {
        if (owner.isUser()) {
            return cartJpaRepository.findByUserId(owner.getUserId());
        }
        return cartJpaRepository.findBySessionId(owner.getSessionId());
    }

    @Override
    public Optional<Cart> findById(Long cartId) {
        return cartJpaRepository.findById(cartId);
    }

    @Override
    public Cart save(Cart cart) {
        // 유니크 제약 위반을 호출부에서 바로 받도록 즉시 flush
        return cartJpaRepository.saveAndFlush(cart);
    }

    @Override
    public List<CartItem> findItems(Long cartId) {
        return cartItemJpaRepository.findByCartIdOrderByCartItemIdAsc(cartId);
    }

    @Override
    public Optional<CartItem> findItemById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    @Transactional
    public void upsertProductItem(Long cartId, Long productId, Long variantId, int quantity) {
        cartItemJpaRepository.upsertProduct(cartId, CartItem.productKey(productId, variantId),
                productId, variantId, quantity);
    }

    @Override
    @Transactional
    public boolean insertCourseItemIfAbsent(Long cartId, Long courseId) {
        return cartItemJpaRepository.insertCourseIgnore(cartId, CartItem.courseKey(courseId), courseId) > 0;
    }

    @Override
    public CartItem saveItem(CartItem item) {
        return cartItemJpaRepository.save(item);
    }

    @Override
    @Transactional
    public void deleteItem(Long cartItemId) {
        cartItemJpaRepository.findById(cartItemId).ifPresent(cartItemJpaRepository::delete);
    }

    @Override
    @Transactional
    public void deleteItems(Long cartId) {
        cartItemJpaRepository.deleteByCartId(cartId);
    }
}

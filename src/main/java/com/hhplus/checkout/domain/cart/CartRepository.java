package com.hhplus.checkout.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * CartRepository - Domain 계층 (Port)
 *
 * 동시 추가 요청이 하나의 행으로 수렴하도록 항목 추가는 upsert 계약을 가집니다.
 */
public interface CartRepository {

    Optional<Cart> findByOwner(CartOwner owner);

    Optional<Cart> findById(Long cartId);

    /**
     * 새 장바구니 저장. 같은 소유자의 장바구니가 이미 있으면
     * org.springframework.dao.DataIntegrityViolationException을 던집니다.
     */
    Cart save(Cart cart);

    List<CartItem> findItems(Long cartId);

    Optional<CartItem> findItemById(Long cartItemId);

    /**
     * (cart, product, variant) 항목이 없으면 만들고, 있으면 수량을 더합니다.
     */
    void upsertProductItem(Long cartId, Long productId, Long variantId, int quantity);

    /**
     * 강의 항목이 없을 때만 추가합니다.
     *
     * @return 새로 추가되었으면 true
     */
    boolean insertCourseItemIfAbsent(Long cartId, Long courseId);

    CartItem saveItem(CartItem item);

    void deleteItem(Long cartItemId);

    void deleteItems(Long cartId);
}

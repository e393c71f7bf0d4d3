package com.hhplus.checkout.infrastructure.persistence.cart;

import com.hhplus.checkout.domain.cart.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CartItem JPA Repository
 *
 * 항목 추가는 (cart_id, item_key) 유니크 제약 위에서 동작하는 네이티브 upsert입니다.
 * 같은 항목을 동시에 추가해도 한 행으로 수렴하고 수량은 합산됩니다.
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByCartIdOrderByCartItemIdAsc(Long cartId);

    @Modifying
    @Query(value = "INSERT INTO cart_items " +
            "(cart_id, item_type, item_key, product_id, variant_id, quantity, created_at, updated_at) " +
            "VALUES (:cartId, 'PRODUCT', :itemKey, :productId, :variantId, :quantity, NOW(6), NOW(6)) " +
            "ON DUPLICATE KEY UPDATE quantity = quantity + VALUES(quantity), updated_at = VALUES(updated_at)",
            nativeQuery = true)
    int upsertProduct(@Param("cartId") Long cartId,
                      @Param("itemKey") String itemKey,
                      @Param("productId") Long productId,
                      @Param("variantId") Long variantId,
                      @Param("quantity") int quantity);

    /**
     * @return 1이면 새로 추가, 0이면 이미 존재
     */
    @Modifying
    @Query(value = "INSERT IGNORE INTO cart_items " +
            "(cart_id, item_type, item_key, course_id, quantity, created_at, updated_at) " +
            "VALUES (:cartId, 'COURSE', :itemKey, :courseId, 1, NOW(6), NOW(6))",
            nativeQuery = true)
    int insertCourseIgnore(@Param("cartId") Long cartId,
                           @Param("itemKey") String itemKey,
                           @Param("courseId") Long courseId);

    @Modifying
    @Query("DELETE FROM CartItem ci WHERE ci.cartId = :cartId")
    int deleteByCartId(@Param("cartId") Long cartId);
}

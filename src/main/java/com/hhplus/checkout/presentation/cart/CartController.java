package com.hhplus.checkout.presentation.cart;

import com.hhplus.checkout.application.cart.CartService;
import com.hhplus.checkout.application.cart.CartSummary;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.presentation.cart.request.AddCartItemRequest;
import com.hhplus.checkout.presentation.cart.request.UpdateQuantityRequest;
import com.hhplus.checkout.presentation.cart.response.CartResponse;
import com.hhplus.checkout.presentation.common.CartOwnerResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 *
 * 소유자는 X-USER-ID 헤더 또는 cart_session 쿠키로 결정되며,
 * 둘 다 없으면 새 세션 쿠키를 발급합니다.
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartOwnerResolver cartOwnerResolver;

    public CartController(CartService cartService, CartOwnerResolver cartOwnerResolver) {
        this.cartService = cartService;
        this.cartOwnerResolver = cartOwnerResolver;
    }

    /**
     * GET /carts - 장바구니 조회 (없으면 생성)
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(HttpServletRequest request, HttpServletResponse response) {
        CartOwner owner = cartOwnerResolver.resolve(request, response);
        CartSummary cart = cartService.getCart(owner);
        return ResponseEntity.ok(CartResponse.from(cart));
    }

    /**
     * POST /carts/items - 상품 또는 강의 추가
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItem(@RequestBody AddCartItemRequest body,
                                                    HttpServletRequest request,
                                                    HttpServletResponse response) {
        CartOwner owner = cartOwnerResolver.resolve(request, response);
        CartSummary cart;
        if (body.isCourse()) {
            cart = cartService.addCourse(owner, body.getCourseId());
        } else {
            if (body.getProductId() == null) {
                throw new ValidationException(ErrorCode.INVALID_REQUEST, "product_id 또는 course_id가 필요합니다");
            }
            cart = cartService.addProduct(owner, body.getProductId(), body.getVariantId(), body.quantityOrDefault());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(CartResponse.from(cart));
    }

    /**
     * PUT /carts/items/{cart_item_id} - 수량 변경 (0이면 삭제)
     */
    @PutMapping("/items/{cart_item_id}")
    public ResponseEntity<CartResponse> updateCartItemQuantity(@PathVariable("cart_item_id") Long cartItemId,
                                                               @RequestBody UpdateQuantityRequest body,
                                                               HttpServletRequest request,
                                                               HttpServletResponse response) {
        if (body.getQuantity() == null) {
            throw new ValidationException(ErrorCode.CART_INVALID_QUANTITY);
        }
        CartOwner owner = cartOwnerResolver.resolve(request, response);
        CartSummary cart = cartService.setQuantity(owner, cartItemId, body.getQuantity());
        return ResponseEntity.ok(CartResponse.from(cart));
    }

    /**
     * DELETE /carts/items/{cart_item_id} - 항목 삭제
     */
    @DeleteMapping("/items/{cart_item_id}")
    public ResponseEntity<CartResponse> removeCartItem(@PathVariable("cart_item_id") Long cartItemId,
                                                       HttpServletRequest request,
                                                       HttpServletResponse response) {
        CartOwner owner = cartOwnerResolver.resolve(request, response);
        CartSummary cart = cartService.removeItem(owner, cartItemId);
        return ResponseEntity.ok(CartResponse.from(cart));
    }

    /**
     * DELETE /carts - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(HttpServletRequest request, HttpServletResponse response) {
        CartOwner owner = cartOwnerResolver.resolve(request, response);
        cartService.clear(owner);
        return ResponseEntity.noContent().build();
    }
}

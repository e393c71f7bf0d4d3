package com.hhplus.checkout.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.cart.CartSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("cart_id")
    private Long cartId;

    private List<CartLineResponse> items;

    private String subtotal;

    private String currency;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;

    @JsonProperty("has_products")
    private boolean hasProducts;

    @JsonProperty("has_courses")
    private boolean hasCourses;

    @JsonProperty("checkout_ready")
    private boolean checkoutReady;

    public static CartResponse from(CartSummary summary) {
        return CartResponse.builder()
                .cartId(summary.getCartId())
                .items(summary.getLines().stream()
                        .map(CartLineResponse::from)
                        .collect(Collectors.toList()))
                .subtotal(summary.getSubtotal().toDecimalString())
                .currency(summary.getSubtotal().getCurrency())
                .totalQuantity(summary.getTotalQuantity())
                .hasProducts(summary.isHasProducts())
                .hasCourses(summary.isHasCourses())
                .checkoutReady(summary.isCheckoutReady())
                .build();
    }
}

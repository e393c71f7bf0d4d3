package com.hhplus.checkout.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.cart.CartLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 응답 DTO
 *
 * 금액은 "25.00" 형태의 문자열. 더 이상 구매할 수 없는 항목은 금액 대신 unavailable_reason을 가집니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CartLineResponse {

    @JsonProperty("cart_item_id")
    private Long cartItemId;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("variant_id")
    private Long variantId;

    @JsonProperty("course_id")
    private Long courseId;

    private String name;

    private Integer quantity;

    @JsonProperty("unit_price")
    private String unitPrice;

    @JsonProperty("line_total")
    private String lineTotal;

    private boolean available;

    @JsonProperty("unavailable_reason")
    private String unavailableReason;

    public static CartLineResponse from(CartLine line) {
        return CartLineResponse.builder()
                .cartItemId(line.getCartItemId())
                .itemType(line.getItemType().name())
                .productId(line.getProductId())
                .variantId(line.getVariantId())
                .courseId(line.getCourseId())
                .name(line.getName())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice() == null ? null : line.getUnitPrice().toDecimalString())
                .lineTotal(line.getLineTotal() == null ? null : line.getLineTotal().toDecimalString())
                .available(line.isAvailable())
                .unavailableReason(line.getUnavailableReason())
                .build();
    }
}

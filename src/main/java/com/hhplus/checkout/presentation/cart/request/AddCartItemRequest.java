package com.hhplus.checkout.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 요청 DTO
 *
 * course_id가 있으면 강의, 없으면 product_id(+ variant_id) 상품으로 처리합니다.
 * 상품 수량을 생략하면 1.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("variant_id")
    private Long variantId;

    @JsonProperty("course_id")
    private Long courseId;

    private Integer quantity;

    @JsonIgnore
    public boolean isCourse() {
        return courseId != null;
    }

    public int quantityOrDefault() {
        return quantity == null ? 1 : quantity;
    }
}

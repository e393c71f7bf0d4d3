package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.domain.cart.CartItemType;
import com.hhplus.checkout.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

/**
 * 장바구니 한 줄 (조회 시점 카탈로그 가격 기준)
 *
 * 상품이 판매 중지되었거나 이미 수강 중인 강의처럼 더 이상 구매할 수 없으면
 * available=false이며 가격 필드는 null입니다.
 */
@Getter
@Builder
public class CartLine {
    private final Long cartItemId;
    private final CartItemType itemType;
    private final Long productId;
    private final Long variantId;
    private final Long courseId;
    private final String name;
    private final int quantity;
    private final Money unitPrice;
    private final Money lineTotal;
    private final boolean available;
    private final String unavailableReason;
}

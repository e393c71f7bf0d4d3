package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 장바구니 조회 결과. 합계는 저장값이 아니라 매 조회마다 다시 계산됩니다.
 */
@Getter
@Builder
public class CartSummary {
    private final Long cartId;
    private final Long userId;
    private final String sessionId;
    private final List<CartLine> lines;
    private final Money subtotal;
    private final int totalQuantity;
    private final boolean hasProducts;
    private final boolean hasCourses;

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public boolean isCheckoutReady() {
        return !lines.isEmpty() && lines.stream().allMatch(CartLine::isAvailable);
    }
}

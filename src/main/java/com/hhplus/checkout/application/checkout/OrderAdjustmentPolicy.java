package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.application.catalog.PricedItem;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderAdjustments;

import java.util.List;

/**
 * 주문 금액 조정 정책 (세금, 배송비, 할인)
 *
 * 반환하는 모든 금액은 subtotal과 같은 통화여야 하며,
 * 할인은 subtotal + tax + shipping을 넘을 수 없습니다.
 */
public interface OrderAdjustmentPolicy {

    OrderAdjustments adjust(List<PricedItem> items, Money subtotal);
}

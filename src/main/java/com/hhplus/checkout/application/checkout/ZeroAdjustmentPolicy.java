package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.application.catalog.PricedItem;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderAdjustments;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 기본 정책: 세금, 배송비, 할인 모두 0
 */
@Component
public class ZeroAdjustmentPolicy implements OrderAdjustmentPolicy {

    @Override
    public OrderAdjustments adjust(List<PricedItem> items, Money subtotal) {
        return OrderAdjustments.none(subtotal.getCurrency());
    }
}

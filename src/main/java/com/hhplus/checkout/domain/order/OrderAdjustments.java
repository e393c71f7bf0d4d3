package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.Getter;

/**
 * 주문 금액 조정 항목 (세금, 배송비, 할인)
 */
@Getter
public class OrderAdjustments {

    private final Money tax;
    private final Money shipping;
    private final Money discount;

    public OrderAdjustments(Money tax, Money shipping, Money discount) {
        this.tax = tax;
        this.shipping = shipping;
        this.discount = discount;
    }

    public static OrderAdjustments none(String currency) {
        Money zero = Money.zero(currency);
        return new OrderAdjustments(zero, zero, zero);
    }
}

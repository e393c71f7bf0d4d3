package com.hhplus.checkout.application.catalog;

import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 카탈로그에서 다시 읽은 현재 가격 정보
 */
@Getter
@AllArgsConstructor
public class PricedItem {
    private final boolean course;
    private final Long productId;
    private final Long variantId;
    private final Long courseId;
    private final String name;
    private final Money unitPrice;
    private final int quantity;

    public Money lineTotal() {
        return unitPrice.multiply(quantity);
    }

    public OrderItem toOrderItem() {
        if (course) {
            return OrderItem.ofCourse(courseId, name, unitPrice);
        }
        return OrderItem.ofProduct(productId, variantId, name, unitPrice, quantity);
    }
}

package com.hhplus.checkout.domain.order;

public enum OrderItemType {
    PRODUCT,
    COURSE
}

package com.hhplus.checkout.domain.cart;

public enum CartItemType {
    PRODUCT,
    COURSE
}

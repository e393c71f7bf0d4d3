package com.hhplus.checkout.domain.payment;

public enum RefundSource {
    ADMIN,
    PROCESSOR
}

package com.hhplus.checkout.domain.catalog;

public enum EnrollmentSource {
    FREE,
    PURCHASE,
    ADMIN
}

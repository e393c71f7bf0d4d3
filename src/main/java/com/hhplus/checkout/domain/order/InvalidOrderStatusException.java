package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.ConflictException;
import com.hhplus.checkout.common.exception.ErrorCode;

public class InvalidOrderStatusException extends ConflictException {

    public InvalidOrderStatusException(Long orderId, String detail) {
        super(ErrorCode.INVALID_ORDER_STATUS, "orderId=" + orderId + ", " + detail);
    }
}

package com.hhplus.checkout.presentation.order;

import com.hhplus.checkout.application.order.OrderService;
import com.hhplus.checkout.application.payment.RefundCommand;
import com.hhplus.checkout.application.payment.RefundResult;
import com.hhplus.checkout.application.payment.RefundService;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.presentation.order.request.RefundRequest;
import com.hhplus.checkout.presentation.order.request.ShipOrderRequest;
import com.hhplus.checkout.presentation.order.response.OrderDetailResponse;
import com.hhplus.checkout.presentation.order.response.RefundResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

/**
 * AdminOrderController - 관리자 주문 API
 *
 * - POST /admin/orders/{order_id}/refunds: 전액/부분 환불
 * - POST /admin/orders/{order_id}/cancel: 미출고 주문 취소
 * - POST /admin/orders/{order_id}/ship: 배송 시작 (송장 번호)
 * - POST /admin/orders/{order_id}/deliver: 배송 완료
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;
    private final RefundService refundService;

    public AdminOrderController(OrderService orderService, RefundService refundService) {
        this.orderService = orderService;
        this.refundService = refundService;
    }

    @PostMapping("/{order_id}/refunds")
    public ResponseEntity<RefundResponse> refund(@PathVariable("order_id") Long orderId,
                                                 @RequestBody(required = false) RefundRequest request) {
        BigDecimal amount = null;
        String reason = null;
        if (request != null) {
            amount = parseAmount(request.getAmount());
            reason = request.getReason();
        }
        RefundResult result = refundService.refund(new RefundCommand(orderId, amount, reason));
        return ResponseEntity.ok(RefundResponse.from(result));
    }

    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderDetailResponse> cancel(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(OrderDetailResponse.from(orderService.cancel(orderId)));
    }

    @PostMapping("/{order_id}/ship")
    public ResponseEntity<OrderDetailResponse> ship(@PathVariable("order_id") Long orderId,
                                                    @RequestBody ShipOrderRequest request) {
        return ResponseEntity.ok(OrderDetailResponse.from(orderService.ship(orderId, request.getTrackingNumber())));
    }

    @PostMapping("/{order_id}/deliver")
    public ResponseEntity<OrderDetailResponse> deliver(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(OrderDetailResponse.from(orderService.deliver(orderId)));
    }

    private BigDecimal parseAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(ErrorCode.INVALID_REFUND_AMOUNT, "amount=" + amount);
        }
    }
}

package com.hhplus.checkout.presentation.order;

import com.hhplus.checkout.application.order.OrderService;
import com.hhplus.checkout.application.order.dto.OrderView;
import com.hhplus.checkout.presentation.common.CartOwnerResolver;
import com.hhplus.checkout.presentation.order.response.OrderDetailResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - Presentation 계층
 *
 * 본인 주문만 조회할 수 있습니다 (X-USER-ID 또는 주문 시 세션 쿠키).
 * 다른 사람의 주문은 존재하지 않는 주문과 같은 404로 응답합니다.
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final CartOwnerResolver cartOwnerResolver;

    public OrderController(OrderService orderService, CartOwnerResolver cartOwnerResolver) {
        this.orderService = orderService;
        this.cartOwnerResolver = cartOwnerResolver;
    }

    /**
     * GET /orders/{order_id} - 주문 상세 조회
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderDetailResponse> getOrderDetail(@PathVariable("order_id") Long orderId,
                                                              HttpServletRequest request) {
        OrderView order = orderService.getOrder(orderId,
                cartOwnerResolver.userId(request), cartOwnerResolver.sessionId(request));
        return ResponseEntity.ok(OrderDetailResponse.from(order));
    }
}

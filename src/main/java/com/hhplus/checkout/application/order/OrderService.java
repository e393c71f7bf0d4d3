package com.hhplus.checkout.application.order;

import com.hhplus.checkout.application.order.dto.OrderView;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * OrderService - 주문 조회 및 관리자 상태 진행
 *
 * 결제/환불에 의한 상태 전이는 여기서 하지 않습니다
 * (PaymentEventHandler, RefundService 담당).
 */
@Slf4j
@Service
public class OrderService {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;

    public OrderService(OrderRepository orderRepository,
                        PaymentRepository paymentRepository) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
    }

    /**
     * 주문 상세 조회. 다른 사용자/세션의 주문은 존재하지 않는 것으로 응답합니다.
     */
    @Transactional(readOnly = true)
    public OrderView getOrder(Long orderId, Long userId, String sessionId) {
        Order order = orderRepository.findById(orderId)
                .filter(o -> o.isPlacedBy(userId, sessionId))
                .orElseThrow(() -> new NotFoundException(ErrorCode.ORDER_NOT_FOUND, orderId));
        return toView(order);
    }

    @Transactional
    public OrderView cancel(Long orderId) {
        Order order = findForUpdate(orderId);
        order.cancel();
        log.info("[OrderService] 관리자 주문 취소 - orderId={}", orderId);
        return toView(orderRepository.save(order));
    }

    @Transactional
    public OrderView ship(Long orderId, String trackingNumber) {
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "운송장 번호는 필수입니다");
        }
        Order order = findForUpdate(orderId);
        order.ship(trackingNumber.trim());
        log.info("[OrderService] 배송 시작 - orderId={}, trackingNumber={}", orderId, trackingNumber);
        return toView(orderRepository.save(order));
    }

    @Transactional
    public OrderView deliver(Long orderId) {
        Order order = findForUpdate(orderId);
        order.deliver();
        log.info("[OrderService] 배송 완료 - orderId={}", orderId);
        return toView(orderRepository.save(order));
    }

    private Order findForUpdate(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.ORDER_NOT_FOUND, orderId));
    }

    private OrderView toView(Order order) {
        Payment payment = paymentRepository.findByOrderId(order.getOrderId()).orElse(null);
        return OrderView.from(order, payment);
    }
}

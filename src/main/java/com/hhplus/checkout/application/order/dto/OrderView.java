package com.hhplus.checkout.application.order.dto;

import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderItem;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 조회 결과 (트랜잭션 안에서 지연 로딩 항목까지 복사)
 */
@Getter
@Builder
public class OrderView {
    private final Long orderId;
    private final String orderNumber;
    private final OrderStatus status;
    private final PaymentStatus paymentStatus;
    private final String email;
    private final Money subtotal;
    private final Money tax;
    private final Money shipping;
    private final Money discount;
    private final Money total;
    private final Money refundedAmount;
    private final String trackingNumber;
    private final List<Item> items;
    private final LocalDateTime createdAt;
    private final LocalDateTime confirmedAt;
    private final LocalDateTime shippedAt;
    private final LocalDateTime deliveredAt;
    private final LocalDateTime cancelledAt;
    private final LocalDateTime refundedAt;

    public static OrderView from(Order order, Payment payment) {
        return OrderView.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus())
                .paymentStatus(order.getPaymentStatus())
                .email(order.getEmail())
                .subtotal(order.getSubtotal())
                .tax(order.getTax())
                .shipping(order.getShipping())
                .discount(order.getDiscount())
                .total(order.getTotal())
                .refundedAmount(payment != null ? payment.getRefundedAmount() : Money.zero(order.getCurrency()))
                .trackingNumber(order.getTrackingNumber())
                .items(order.getOrderItems().stream().map(Item::from).collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .confirmedAt(order.getConfirmedAt())
                .shippedAt(order.getShippedAt())
                .deliveredAt(order.getDeliveredAt())
                .cancelledAt(order.getCancelledAt())
                .refundedAt(order.getRefundedAt())
                .build();
    }

    @Getter
    @Builder
    public static class Item {
        private final Long orderItemId;
        private final String itemType;
        private final Long productId;
        private final Long variantId;
        private final Long courseId;
        private final String name;
        private final int quantity;
        private final Money unitPrice;
        private final Money lineTotal;

        public static Item from(OrderItem item) {
            return Item.builder()
                    .orderItemId(item.getOrderItemId())
                    .itemType(item.getItemType().name())
                    .productId(item.getProductId())
                    .variantId(item.getVariantId())
                    .courseId(item.getCourseId())
                    .name(item.getName())
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice())
                    .lineTotal(item.getLineTotal())
                    .build();
        }
    }
}

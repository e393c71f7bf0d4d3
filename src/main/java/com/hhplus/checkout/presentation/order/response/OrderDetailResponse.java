package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.order.dto.OrderView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 상세 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderDetailResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_number")
    private String orderNumber;

    private String status;

    @JsonProperty("payment_status")
    private String paymentStatus;

    private String email;

    private String currency;

    private String subtotal;

    private String tax;

    private String shipping;

    private String discount;

    private String total;

    @JsonProperty("refunded_amount")
    private String refundedAmount;

    @JsonProperty("tracking_number")
    private String trackingNumber;

    private List<OrderItemResponse> items;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("confirmed_at")
    private LocalDateTime confirmedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("shipped_at")
    private LocalDateTime shippedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("delivered_at")
    private LocalDateTime deliveredAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("cancelled_at")
    private LocalDateTime cancelledAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("refunded_at")
    private LocalDateTime refundedAt;

    public static OrderDetailResponse from(OrderView view) {
        return OrderDetailResponse.builder()
                .orderId(view.getOrderId())
                .orderNumber(view.getOrderNumber())
                .status(view.getStatus().name())
                .paymentStatus(view.getPaymentStatus().name())
                .email(view.getEmail())
                .currency(view.getTotal().getCurrency())
                .subtotal(view.getSubtotal().toDecimalString())
                .tax(view.getTax().toDecimalString())
                .shipping(view.getShipping().toDecimalString())
                .discount(view.getDiscount().toDecimalString())
                .total(view.getTotal().toDecimalString())
                .refundedAmount(view.getRefundedAmount().toDecimalString())
                .trackingNumber(view.getTrackingNumber())
                .items(view.getItems().stream()
                        .map(OrderItemResponse::from)
                        .collect(Collectors.toList()))
                .createdAt(view.getCreatedAt())
                .confirmedAt(view.getConfirmedAt())
                .shippedAt(view.getShippedAt())
                .deliveredAt(view.getDeliveredAt())
                .cancelledAt(view.getCancelledAt())
                .refundedAt(view.getRefundedAt())
                .build();
    }
}

package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 체크아웃 시점 장바구니의 스냅샷 (항목, 단가, 금액)
 * - 주문 상태 전이
 *
 * 핵심 비즈니스 규칙:
 * - total = subtotal + tax + shipping - discount
 * - Σ item.lineTotal = subtotal
 * - 금액과 항목은 생성 이후 변경되지 않으며, 상태/배송 정보만 바뀜
 * - 상태 전이는 검증된 프로세서 이벤트 또는 관리자 요청으로만 일어남
 */
@Entity
@Table(name = "orders")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", nullable = false, unique = true, length = 32)
    private String orderNumber;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "guest_session_id", length = 64)
    private String guestSessionId;

    // 결제 성공 시 비울 원본 장바구니
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "email")
    private String email;

    @Column(name = "status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "payment_status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "subtotal", nullable = false)
    private Long subtotalAmount;

    @Column(name = "tax", nullable = false)
    private Long taxAmount;

    @Column(name = "shipping", nullable = false)
    private Long shippingAmount;

    @Column(name = "discount", nullable = false)
    private Long discountAmount;

    @Column(name = "total", nullable = false)
    private Long totalAmount;

    @Column(name = "tracking_number")
    private String trackingNumber;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "shipped_at")
    private LocalDateTime shippedAt;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 항목 관계
     * 체크아웃 보상(프로세서 호출 실패) 시 주문과 함께 삭제되므로 REMOVE도 전파
     */
    @OneToMany(cascade = {CascadeType.PERSIST, CascadeType.REMOVE}, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 최소 1개 이상의 항목
     * - 모든 금액은 같은 통화
     * - 할인은 (subtotal + tax + shipping)을 넘을 수 없음
     *
     * @param userId         로그인 사용자 (비로그인 주문이면 null)
     * @param guestSessionId 비로그인 세션 토큰 (로그인 주문이면 null)
     */
    public static Order place(String orderNumber, Long userId, String guestSessionId, Long cartId, String email,
                              List<OrderItem> items, OrderAdjustments adjustments) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목이 최소 1개 이상 필요합니다");
        }
        if (userId == null && (guestSessionId == null || guestSessionId.isBlank())) {
            throw new IllegalArgumentException("주문자는 사용자 또는 세션 중 하나가 필요합니다");
        }

        String currency = items.get(0).getCurrency();
        Money subtotal = Money.zero(currency);
        for (OrderItem item : items) {
            subtotal = subtotal.add(item.getLineTotal());
        }
        Money total = subtotal
                .add(adjustments.getTax())
                .add(adjustments.getShipping())
                .subtract(adjustments.getDiscount());

        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .orderNumber(orderNumber)
                .userId(userId)
                .guestSessionId(userId == null ? guestSessionId : null)
                .cartId(cartId)
                .email(email)
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .currency(currency)
                .subtotalAmount(subtotal.getAmount())
                .taxAmount(adjustments.getTax().getAmount())
                .shippingAmount(adjustments.getShipping().getAmount())
                .discountAmount(adjustments.getDiscount().getAmount())
                .totalAmount(total.getAmount())
                .orderItems(new ArrayList<>(items))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Money getSubtotal() {
        return Money.ofMinor(subtotalAmount, currency);
    }

    public Money getTax() {
        return Money.ofMinor(taxAmount, currency);
    }

    public Money getShipping() {
        return Money.ofMinor(shippingAmount, currency);
    }

    public Money getDiscount() {
        return Money.ofMinor(discountAmount, currency);
    }

    public Money getTotal() {
        return Money.ofMinor(totalAmount, currency);
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public List<Long> getCourseIds() {
        List<Long> courseIds = new ArrayList<>();
        for (OrderItem item : orderItems) {
            if (item.isCourse()) {
                courseIds.add(item.getCourseId());
            }
        }
        return courseIds;
    }

    /**
     * 금액 불변식 확인: subtotal + tax + shipping - discount == total, Σ lineTotal == subtotal
     */
    public boolean isBalanced() {
        long itemSum = orderItems.stream().mapToLong(OrderItem::getLineTotalAmount).sum();
        return itemSum == subtotalAmount
                && subtotalAmount + taxAmount + shippingAmount - discountAmount == totalAmount;
    }

    public boolean isPlacedBy(Long userId, String sessionId) {
        if (this.userId != null) {
            return this.userId.equals(userId);
        }
        return this.guestSessionId != null && this.guestSessionId.equals(sessionId);
    }

    /**
     * 상태 전환: 결제 성공 (PENDING → CONFIRMED)
     */
    public void confirmPayment() {
        if (this.status != OrderStatus.PENDING) {
            throw new InvalidOrderStatusException(this.orderId,
                    "결제 확정으로 변경할 수 없습니다. 현재 상태: " + this.status.name());
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = OrderStatus.CONFIRMED;
        this.paymentStatus = PaymentStatus.PAID;
        this.confirmedAt = now;
        this.updatedAt = now;
    }

    /**
     * 결제 실패 기록. 주문은 PENDING으로 남습니다.
     */
    public void markPaymentFailed() {
        if (this.status != OrderStatus.PENDING) {
            throw new InvalidOrderStatusException(this.orderId,
                    "결제 실패를 기록할 수 없습니다. 현재 상태: " + this.status.name());
        }
        this.paymentStatus = PaymentStatus.FAILED;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 상태 전환: 관리자 취소 (PENDING/CONFIRMED → CANCELLED)
     *
     * 배송이 시작된 주문은 취소할 수 없습니다.
     */
    public void cancel() {
        if (!isCancellable()) {
            throw new InvalidOrderStatusException(this.orderId,
                    "취소할 수 없습니다. 현재 상태: " + this.status.name());
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = now;
        this.updatedAt = now;
    }

    public boolean isCancellable() {
        return this.status == OrderStatus.PENDING || this.status == OrderStatus.CONFIRMED;
    }

    /**
     * 상태 전환: 배송 시작 (CONFIRMED → SHIPPED)
     */
    public void ship(String trackingNumber) {
        if (this.status != OrderStatus.CONFIRMED) {
            throw new InvalidOrderStatusException(this.orderId,
                    "배송을 시작할 수 없습니다. 현재 상태: " + this.status.name());
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = OrderStatus.SHIPPED;
        this.trackingNumber = trackingNumber;
        this.shippedAt = now;
        this.updatedAt = now;
    }

    /**
     * 상태 전환: 배송 완료 (SHIPPED → DELIVERED)
     */
    public void deliver() {
        if (this.status != OrderStatus.SHIPPED) {
            throw new InvalidOrderStatusException(this.orderId,
                    "배송 완료로 변경할 수 없습니다. 현재 상태: " + this.status.name());
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = OrderStatus.DELIVERED;
        this.deliveredAt = now;
        this.updatedAt = now;
    }

    /**
     * 환불 반영
     *
     * - 전액 환불: 주문 REFUNDED, 결제 상태 REFUNDED
     * - 부분 환불: 주문 상태 유지, 결제 상태 PARTIALLY_REFUNDED
     */
    public void applyRefund(boolean fullRefund) {
        LocalDateTime now = LocalDateTime.now();
        if (fullRefund) {
            this.status = OrderStatus.REFUNDED;
            this.paymentStatus = PaymentStatus.REFUNDED;
            this.refundedAt = now;
        } else {
            this.paymentStatus = PaymentStatus.PARTIALLY_REFUNDED;
        }
        this.updatedAt = now;
    }

    public boolean isPending() {
        return this.status == OrderStatus.PENDING;
    }
}

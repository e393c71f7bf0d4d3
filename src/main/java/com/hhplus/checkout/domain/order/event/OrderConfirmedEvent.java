package com.hhplus.checkout.domain.order.event;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 결제 확정 이벤트
 * 결제 성공 이벤트로 주문이 CONFIRMED가 된 트랜잭션에서 발행됩니다.
 */
@Getter
@ToString
public class OrderConfirmedEvent extends ApplicationEvent {

    private final Long orderId;
    private final String orderNumber;
    private final Long userId;
    private final String email;
    private final List<Long> courseIds;
    private final Money total;
    private final LocalDateTime occurredAt;

    public OrderConfirmedEvent(Long orderId, String orderNumber, Long userId, String email,
                               List<Long> courseIds, Money total) {
        super(orderId);
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.email = email;
        this.courseIds = List.copyOf(courseIds);
        this.total = total;
        this.occurredAt = LocalDateTime.now();
    }
}

package com.hhplus.checkout.infrastructure.external;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * EmailNotificationClient - 주문 확인 메일 발송 클라이언트
 *
 * 현재 구현:
 * - 로깅 기반 stub (메일 공급자 연동 시 이 클래스만 교체)
 */
@Slf4j
@Component
public class EmailNotificationClient {

    public void sendOrderConfirmation(String email, String orderNumber, Money total) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("수신자 이메일이 비어 있습니다");
        }
        log.info("[EmailNotificationClient] 주문 확인 메일 발송 - to={}, orderNumber={}, total={}",
                email, orderNumber, total.toDecimalString() + " " + total.getCurrency());
    }
}

package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 결제 의도가 연결되지 않은 채 남은 PENDING 주문 정리
 *
 * 체크아웃 도중 프로세스가 죽어 보상이 실행되지 못한 경우를 수습합니다.
 * 결제 의도가 붙은 주문은 결제 이벤트가 올 수 있으므로 건드리지 않습니다.
 */
@Slf4j
@Component
public class StaleCheckoutSweeper {

    private final PaymentRepository paymentRepository;
    private final CheckoutTransactionService checkoutTransactionService;
    private final Clock clock;
    private final long staleMinutes;

    public StaleCheckoutSweeper(PaymentRepository paymentRepository,
                                CheckoutTransactionService checkoutTransactionService,
                                Clock clock,
                                @Value("${checkout.checkout.stale-pending-minutes:30}") long staleMinutes) {
        this.paymentRepository = paymentRepository;
        this.checkoutTransactionService = checkoutTransactionService;
        this.clock = clock;
        this.staleMinutes = staleMinutes;
    }

    @Scheduled(fixedDelayString = "${checkout.checkout.sweep-interval-ms:300000}")
    public int sweep() {
        LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(staleMinutes);
        List<Payment> stale = paymentRepository.findPendingWithoutIntentCreatedBefore(threshold);
        if (stale.isEmpty()) {
            return 0;
        }

        int discarded = 0;
        for (Payment payment : stale) {
            try {
                checkoutTransactionService.discardPendingOrder(payment.getOrderId());
                discarded++;
            } catch (RuntimeException e) {
                log.error("[StaleCheckoutSweeper] 정리 실패 - orderId={}", payment.getOrderId(), e);
            }
        }
        log.info("[StaleCheckoutSweeper] 미완료 체크아웃 정리 - threshold={}, discarded={}/{}",
                threshold, discarded, stale.size());
        return discarded;
    }
}

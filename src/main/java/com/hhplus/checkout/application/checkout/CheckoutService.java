package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.application.processor.ChargeIntent;
import com.hhplus.checkout.application.processor.ChargeIntentRequest;
import com.hhplus.checkout.application.processor.PaymentProcessorClient;
import com.hhplus.checkout.application.processor.ProcessorConfiguration;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.order.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * CheckoutService - 체크아웃 오케스트레이터 (Application 계층)
 *
 * 플로우:
 * CheckoutController
 *     ↓
 * CheckoutService.checkout()
 *     ├─ 1단계: 프로세서 설정 확인
 *     ├─ 2단계: 재검증 + PENDING 주문/결제 커밋 (CheckoutTransactionService)
 *     ├─ 3단계: 프로세서 결제 의도 생성 (트랜잭션 없음, 멱등 키 = 주문 ID)
 *     │    └─ 실패 시 보상: 주문/결제 삭제 후 ExternalProcessorException
 *     └─ 4단계: 결제 의도 ID 연결
 *
 * 주문 확정은 여기서 하지 않습니다. 검증된 결제 성공 이벤트만 주문을 CONFIRMED로 바꿉니다.
 */
@Slf4j
@Service
public class CheckoutService {

    private static final String IDEMPOTENCY_PREFIX = "checkout-";

    private final CheckoutTransactionService checkoutTransactionService;
    private final PaymentProcessorClient processorClient;
    private final ProcessorConfiguration processorConfiguration;

    public CheckoutService(CheckoutTransactionService checkoutTransactionService,
                           PaymentProcessorClient processorClient,
                           ProcessorConfiguration processorConfiguration) {
        this.checkoutTransactionService = checkoutTransactionService;
        this.processorClient = processorClient;
        this.processorConfiguration = processorConfiguration;
    }

    public CheckoutResult checkout(CheckoutCommand command) {
        if (!processorConfiguration.isConfigured()) {
            throw new ExternalProcessorException(ErrorCode.PROCESSOR_NOT_CONFIGURED);
        }
        // 비로그인 주문은 확인 메일 주소가 유일한 연락 수단
        if (!command.getOwner().isUser() && (command.getEmail() == null || command.getEmail().isBlank())) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "비로그인 주문은 이메일이 필요합니다");
        }

        PendingCheckout pending = checkoutTransactionService.createPendingOrder(command.getOwner(), command.getEmail());
        Order order = pending.getOrder();

        ChargeIntent intent;
        try {
            intent = processorClient.createChargeIntent(ChargeIntentRequest.builder()
                    .amount(order.getTotal())
                    .orderId(order.getOrderId())
                    .orderNumber(order.getOrderNumber())
                    .idempotencyKey(IDEMPOTENCY_PREFIX + order.getOrderId())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[CheckoutService] 결제 의도 생성 실패, 주문 폐기 - orderId={}, reason={}",
                    order.getOrderId(), e.getMessage());
            checkoutTransactionService.discardPendingOrder(order.getOrderId());
            if (e instanceof ExternalProcessorException) {
                throw e;
            }
            throw new ExternalProcessorException(ErrorCode.PROCESSOR_REQUEST_FAILED.getMessage(), e);
        }

        checkoutTransactionService.attachChargeIntent(pending.getPayment().getPaymentId(), intent.getId());
        log.info("[CheckoutService] 체크아웃 완료 - orderId={}, chargeIntentId={}", order.getOrderId(), intent.getId());

        return CheckoutResult.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus())
                .subtotal(order.getSubtotal())
                .total(order.getTotal())
                .chargeIntentId(intent.getId())
                .clientSecret(intent.getClientSecret())
                .build();
    }
}

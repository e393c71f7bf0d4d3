package com.hhplus.checkout.application.processor;

/**
 * 외부 결제 프로세서 포트
 *
 * 모든 호출은 동기이며 명시적인 타임아웃을 가집니다.
 * 실패는 ExternalProcessorException으로 통일됩니다.
 * 호출하는 쪽은 이 메서드를 트랜잭션이나 락을 잡은 채로 부르지 않아야 합니다.
 */
public interface PaymentProcessorClient {

    ChargeIntent createChargeIntent(ChargeIntentRequest request);

    SubscriptionCheckoutSession createSubscriptionCheckout(SubscriptionCheckoutRequest request);

    ProcessorRefund createRefund(ProcessorRefundRequest request);
}

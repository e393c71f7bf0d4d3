package com.hhplus.checkout.infrastructure.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.checkout.application.processor.ChargeIntent;
import com.hhplus.checkout.application.processor.ChargeIntentRequest;
import com.hhplus.checkout.application.processor.ProcessorConfiguration;
import com.hhplus.checkout.application.processor.ProcessorCredentials;
import com.hhplus.checkout.application.processor.ProcessorRefund;
import com.hhplus.checkout.application.processor.ProcessorRefundRequest;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.domain.common.vo.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * HttpPaymentProcessorClientTest
 *
 * 재시도 프록시 없이 요청 형식과 오류 변환만 검증합니다.
 */
@DisplayName("HttpPaymentProcessorClient 테스트")
class HttpPaymentProcessorClientTest {

    private static final String BASE_URL = "http://processor.test";

    private MockRestServiceServer server;
    private ProcessorConfiguration processorConfiguration;
    private HttpPaymentProcessorClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        processorConfiguration = new ProcessorConfiguration(
                new ProcessorCredentials("pk_test_public", "sk_test_secret", "whsec_test"));
        client = new HttpPaymentProcessorClient(restTemplate, processorConfiguration, new ObjectMapper(), BASE_URL + "/");
    }

    private ChargeIntentRequest chargeRequest() {
        return ChargeIntentRequest.builder()
                .amount(Money.ofMinor(15000L, "USD"))
                .orderId(7L)
                .orderNumber("ORD-2610-ABC123")
                .idempotencyKey("checkout-7")
                .build();
    }

    @Test
    @DisplayName("결제 의도 생성 - 인증, 멱등성 키, 금액과 메타데이터를 보낸다")
    void testCreateChargeIntent() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/charge_intents"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk_test_secret"))
                .andExpect(header(HttpPaymentProcessorClient.IDEMPOTENCY_HEADER, "checkout-7"))
                .andExpect(jsonPath("$.amount").value(15000))
                .andExpect(jsonPath("$.currency").value("usd"))
                .andExpect(jsonPath("$.metadata.orderId").value("7"))
                .andExpect(jsonPath("$.metadata.orderNumber").value("ORD-2610-ABC123"))
                .andRespond(withSuccess("{\"id\":\"ci_123\",\"client_secret\":\"ci_123_secret\"}",
                        MediaType.APPLICATION_JSON));

        // When
        ChargeIntent intent = client.createChargeIntent(chargeRequest());

        // Then
        assertEquals("ci_123", intent.getId());
        assertEquals("ci_123_secret", intent.getClientSecret());
        server.verify();
    }

    @Test
    @DisplayName("환불 생성 - 프로세서가 돌려준 환불 ID와 금액을 반환한다")
    void testCreateRefund() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/refunds"))
                .andExpect(jsonPath("$.charge_intent").value("ci_123"))
                .andExpect(jsonPath("$.amount").value(5000))
                .andExpect(jsonPath("$.metadata.reason").value("고객 요청"))
                .andRespond(withSuccess("{\"id\":\"re_1\",\"amount\":5000,\"status\":\"succeeded\"}",
                        MediaType.APPLICATION_JSON));

        // When
        ProcessorRefund refund = client.createRefund(ProcessorRefundRequest.builder()
                .chargeIntentId("ci_123")
                .amount(Money.ofMinor(5000L, "USD"))
                .reason("고객 요청")
                .idempotencyKey("refund-1-0-5000")
                .build());

        // Then
        assertEquals("re_1", refund.getId());
        assertEquals(5000L, refund.getAmountMinor());
        assertEquals("succeeded", refund.getStatus());
    }

    @Test
    @DisplayName("4xx 응답 - 프로세서 메시지를 그대로 담아 즉시 실패한다")
    void testClientError() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/charge_intents"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Your card was declined.\"}}"));

        // When & Then
        ExternalProcessorException e = assertThrows(ExternalProcessorException.class,
                () -> client.createChargeIntent(chargeRequest()));
        assertEquals("Your card was declined.", e.getProcessorMessage());
        assertEquals(ErrorCode.PROCESSOR_REQUEST_FAILED, e.getErrorCode());
    }

    @Test
    @DisplayName("5xx 응답 - 재시도 대상 예외로 분류되고, 복구 시 ExternalProcessorException으로 변환된다")
    void testServerError() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/charge_intents")).andRespond(withServerError());

        // When
        TransientProcessorException transientFailure = assertThrows(TransientProcessorException.class,
                () -> client.createChargeIntent(chargeRequest()));

        // Then
        ExternalProcessorException e = assertThrows(ExternalProcessorException.class,
                () -> client.recoverChargeIntent(transientFailure, chargeRequest()));
        assertSame(transientFailure, e.getCause());
    }

    @Test
    @DisplayName("복구 - 이미 변환된 프로세서 예외는 그대로 다시 던진다")
    void testRecover_PassThrough() {
        // Given
        ExternalProcessorException declined = new ExternalProcessorException("declined");

        // When & Then
        ExternalProcessorException e = assertThrows(ExternalProcessorException.class,
                () -> client.recoverChargeIntent(declined, chargeRequest()));
        assertSame(declined, e);
    }

    @Test
    @DisplayName("시크릿 키가 없으면 호출하지 않고 PROCESSOR_NOT_CONFIGURED")
    void testNotConfigured() {
        // Given
        processorConfiguration.reconfigure(ProcessorCredentials.empty());

        // When & Then
        ExternalProcessorException e = assertThrows(ExternalProcessorException.class,
                () -> client.createChargeIntent(chargeRequest()));
        assertEquals(ErrorCode.PROCESSOR_NOT_CONFIGURED, e.getErrorCode());
        server.verify();
    }

    @Test
    @DisplayName("응답에 id가 없으면 실패한다")
    void testMissingId() {
        // Given
        server.expect(requestTo(BASE_URL + "/v1/charge_intents"))
                .andRespond(withSuccess("{\"client_secret\":\"x\"}", MediaType.APPLICATION_JSON));

        // When & Then
        assertThrows(ExternalProcessorException.class, () -> client.createChargeIntent(chargeRequest()));
    }
}

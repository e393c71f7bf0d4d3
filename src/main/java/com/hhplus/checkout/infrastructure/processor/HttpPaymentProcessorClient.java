package com.hhplus.checkout.infrastructure.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.checkout.application.processor.*;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HttpPaymentProcessorClient - 결제 프로세서 REST 어댑터 (Infrastructure 계층)
 *
 * - 인증: Bearer {secretKey}. 매 호출마다 ProcessorConfiguration.current()를 읽어 키 교체가 즉시 반영됨
 * - 모든 POST에 Idempotency-Key 헤더
 * - 4xx: ExternalProcessorException (프로세서 메시지 그대로, 재시도 없음)
 * - I/O 오류, 타임아웃, 5xx: 짧은 대기 후 1회 재시도, 그래도 실패하면 ExternalProcessorException
 *
 * @Recover는 반환 타입별로 하나씩 두며, 재시도 대상이 아닌 예외도 여기를 거쳐 그대로 다시 던집니다.
 */
@Slf4j
@Component
public class HttpPaymentProcessorClient implements PaymentProcessorClient {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    private static final String TRANSIENT_FAILURE_MESSAGE = "결제 프로세서에 연결할 수 없습니다. 잠시 후 다시 시도해주세요";

    private final RestTemplate restTemplate;
    private final ProcessorConfiguration processorConfiguration;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpPaymentProcessorClient(RestTemplate processorRestTemplate,
                                      ProcessorConfiguration processorConfiguration,
                                      ObjectMapper objectMapper,
                                      @Value("${checkout.processor.base-url}") String baseUrl) {
        this.restTemplate = processorRestTemplate;
        this.processorConfiguration = processorConfiguration;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    @Retryable(retryFor = TransientProcessorException.class, maxAttempts = 2,
            backoff = @Backoff(delayExpression = "${checkout.processor.retry-backoff-ms:200}"))
    public ChargeIntent createChargeIntent(ChargeIntentRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("orderId", String.valueOf(request.getOrderId()));
        metadata.put("orderNumber", request.getOrderNumber());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", request.getAmount().getAmount());
        body.put("currency", request.getAmount().getCurrency().toLowerCase(Locale.ROOT));
        body.put("metadata", metadata);

        JsonNode response = post("/v1/charge_intents", body, request.getIdempotencyKey());
        log.info("[HttpPaymentProcessorClient] 결제 의도 생성 - orderId={}, id={}", request.getOrderId(), response.path("id").asText());
        return new ChargeIntent(requiredText(response, "id"), response.path("client_secret").asText(null));
    }

    @Override
    @Retryable(retryFor = TransientProcessorException.class, maxAttempts = 2,
            backoff = @Backoff(delayExpression = "${checkout.processor.retry-backoff-ms:200}"))
    public SubscriptionCheckoutSession createSubscriptionCheckout(SubscriptionCheckoutRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", String.valueOf(request.getUserId()));
        metadata.put("planId", request.getPlanId());
        metadata.put("billingCycle", request.getBillingCycle().name());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("price", request.getPriceId());
        body.put("customer_email", request.getCustomerEmail());
        body.put("success_url", request.getSuccessUrl());
        body.put("cancel_url", request.getCancelUrl());
        body.put("metadata", metadata);

        JsonNode response = post("/v1/subscription_checkouts", body, request.getIdempotencyKey());
        return new SubscriptionCheckoutSession(requiredText(response, "id"), response.path("url").asText(null));
    }

    @Override
    @Retryable(retryFor = TransientProcessorException.class, maxAttempts = 2,
            backoff = @Backoff(delayExpression = "${checkout.processor.retry-backoff-ms:200}"))
    public ProcessorRefund createRefund(ProcessorRefundRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.getReason() != null) {
            metadata.put("reason", request.getReason());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("charge_intent", request.getChargeIntentId());
        body.put("amount", request.getAmount().getAmount());
        body.put("metadata", metadata);

        JsonNode response = post("/v1/refunds", body, request.getIdempotencyKey());
        return new ProcessorRefund(requiredText(response, "id"),
                response.path("amount").asLong(request.getAmount().getAmount()),
                response.path("status").asText(null));
    }

    @Recover
    public ChargeIntent recoverChargeIntent(RuntimeException e, ChargeIntentRequest request) {
        throw translate(e, "charge_intent orderId=" + request.getOrderId());
    }

    @Recover
    public SubscriptionCheckoutSession recoverSubscriptionCheckout(RuntimeException e, SubscriptionCheckoutRequest request) {
        throw translate(e, "subscription_checkout userId=" + request.getUserId());
    }

    @Recover
    public ProcessorRefund recoverRefund(RuntimeException e, ProcessorRefundRequest request) {
        throw translate(e, "refund chargeIntentId=" + request.getChargeIntentId());
    }

    private JsonNode post(String path, Map<String, Object> body, String idempotencyKey) {
        ProcessorCredentials credentials = processorConfiguration.current();
        if (!credentials.hasSecretKey()) {
            throw new ExternalProcessorException(ErrorCode.PROCESSOR_NOT_CONFIGURED);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(credentials.getSecretKey());
        headers.set(IDEMPOTENCY_HEADER, idempotencyKey);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
            JsonNode responseBody = response.getBody();
            if (responseBody == null || !responseBody.isObject()) {
                throw new ExternalProcessorException("결제 프로세서 응답이 비어 있습니다");
            }
            return responseBody;
        } catch (HttpClientErrorException e) {
            String message = extractErrorMessage(e);
            log.warn("[HttpPaymentProcessorClient] 프로세서 요청 거부 - path={}, status={}, message={}",
                    path, e.getStatusCode().value(), message);
            throw new ExternalProcessorException(message, e);
        } catch (HttpServerErrorException e) {
            log.warn("[HttpPaymentProcessorClient] 프로세서 서버 오류 - path={}, status={}", path, e.getStatusCode().value());
            throw new TransientProcessorException("status=" + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("[HttpPaymentProcessorClient] 프로세서 연결 실패 - path={}, reason={}", path, e.getMessage());
            throw new TransientProcessorException(e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExternalProcessorException(ErrorCode.PROCESSOR_REQUEST_FAILED.getMessage(), e);
        }
    }

    private ExternalProcessorException translate(RuntimeException e, String context) {
        if (e instanceof ExternalProcessorException) {
            return (ExternalProcessorException) e;
        }
        log.error("[HttpPaymentProcessorClient] 재시도 후에도 실패 - {}", context, e);
        return new ExternalProcessorException(TRANSIENT_FAILURE_MESSAGE, e);
    }

    private String extractErrorMessage(HttpClientErrorException e) {
        String fallback = ErrorCode.PROCESSOR_REQUEST_FAILED.getMessage() + " (status=" + e.getStatusCode().value() + ")";
        String responseBody = e.getResponseBodyAsString();
        if (responseBody.isBlank()) {
            return fallback;
        }
        try {
            JsonNode message = objectMapper.readTree(responseBody).path("error").path("message");
            return message.isTextual() && !message.asText().isBlank() ? message.asText() : fallback;
        } catch (IOException parseFailure) {
            return fallback;
        }
    }

    private String requiredText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ExternalProcessorException("결제 프로세서 응답에 " + field + "가 없습니다");
        }
        return value.asText();
    }
}

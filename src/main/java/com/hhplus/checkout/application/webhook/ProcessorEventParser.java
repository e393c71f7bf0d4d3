package com.hhplus.checkout.application.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.checkout.application.webhook.event.*;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * 프로세서 이벤트 파서
 *
 * 봉투 형식: { "id", "type", "created", "data": { "object": {...} } }
 *
 * 경계에서 유형별 이벤트 클래스로 변환하며, 알려진 유형인데 필수 필드가 빠진 경우
 * ValidationException(MALFORMED_EVENT)로 거부합니다. 알 수 없는 유형은 UnsupportedEvent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessorEventParser {

    private static final String SUBSCRIPTION_MODE = "subscription";

    private final ObjectMapper objectMapper;

    public ProcessorEvent parse(byte[] payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "JSON 파싱 실패");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "JSON 객체가 아닙니다");
        }

        String eventId = requiredText(root, "id");
        String rawType = requiredText(root, "type");
        Instant createdAt = root.hasNonNull("created")
                ? Instant.ofEpochSecond(root.get("created").asLong())
                : Instant.now();

        ProcessorEventType type = ProcessorEventType.fromWireName(rawType);
        if (type == ProcessorEventType.UNSUPPORTED) {
            return new UnsupportedEvent(eventId, rawType, createdAt);
        }

        JsonNode object = root.path("data").path("object");
        if (!object.isObject()) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "data.object가 없습니다 - eventId=" + eventId);
        }

        return switch (type) {
            case PAYMENT_SUCCEEDED, PAYMENT_FAILED -> parsePaymentIntent(eventId, rawType, createdAt, type, object);
            case CHARGE_REFUNDED -> parseChargeRefunded(eventId, rawType, createdAt, object);
            case CHECKOUT_COMPLETED -> parseCheckoutCompleted(eventId, rawType, createdAt, object);
            case SUBSCRIPTION_CREATED, SUBSCRIPTION_UPDATED, SUBSCRIPTION_DELETED ->
                    parseSubscription(eventId, rawType, createdAt, type, object, null);
            case INVOICE_PAYMENT_FAILED -> new InvoicePaymentFailedEvent(eventId, rawType, createdAt,
                    optionalText(object, "id"),
                    optionalText(object, "customer"),
                    optionalText(object, "subscription"));
            case UNSUPPORTED -> new UnsupportedEvent(eventId, rawType, createdAt);
        };
    }

    private PaymentIntentEvent parsePaymentIntent(String eventId, String rawType, Instant createdAt,
                                                  ProcessorEventType type, JsonNode object) {
        return PaymentIntentEvent.builder()
                .eventId(eventId)
                .rawType(rawType)
                .createdAt(createdAt)
                .succeeded(type == ProcessorEventType.PAYMENT_SUCCEEDED)
                .chargeIntentId(requiredText(object, "id"))
                .amountMinor(object.path("amount").asLong())
                .currency(optionalText(object, "currency"))
                .chargeId(optionalText(object, "latest_charge"))
                .orderId(optionalLong(object.path("metadata"), "orderId"))
                .failureMessage(optionalText(object.path("last_payment_error"), "message"))
                .build();
    }

    private ChargeRefundedEvent parseChargeRefunded(String eventId, String rawType, Instant createdAt, JsonNode object) {
        if (!object.has("amount_refunded")) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "amount_refunded가 없습니다 - eventId=" + eventId);
        }
        String latestRefundId = null;
        JsonNode refunds = object.path("refunds").path("data");
        if (refunds.isArray() && refunds.size() > 0) {
            latestRefundId = optionalText(refunds.get(0), "id");
        }
        return ChargeRefundedEvent.builder()
                .eventId(eventId)
                .rawType(rawType)
                .createdAt(createdAt)
                .chargeId(requiredText(object, "id"))
                .chargeIntentId(optionalText(object, "payment_intent"))
                .amountMinor(object.path("amount").asLong())
                .amountRefundedMinor(object.path("amount_refunded").asLong())
                .currency(optionalText(object, "currency"))
                .fullyRefunded(object.path("refunded").asBoolean(false))
                .latestRefundId(latestRefundId)
                .build();
    }

    /**
     * 구독 모드가 아닌 checkout.session.completed는 처리 대상이 아닙니다.
     * 세션의 metadata가 구독 객체의 metadata보다 우선합니다.
     */
    private ProcessorEvent parseCheckoutCompleted(String eventId, String rawType, Instant createdAt, JsonNode session) {
        if (!SUBSCRIPTION_MODE.equals(optionalText(session, "mode"))) {
            log.info("[ProcessorEventParser] 구독 모드가 아닌 체크아웃 세션 - eventId={}, mode={}",
                    eventId, optionalText(session, "mode"));
            return new UnsupportedEvent(eventId, rawType, createdAt);
        }

        JsonNode subscription = session.path("subscription");
        if (subscription.isObject()) {
            return parseSubscription(eventId, rawType, createdAt, ProcessorEventType.CHECKOUT_COMPLETED,
                    subscription, session);
        }
        if (!subscription.isTextual()) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "subscription이 없습니다 - eventId=" + eventId);
        }

        // 구독 ID만 포함된 세션: 결제 완료된 세션이므로 active로 간주
        JsonNode metadata = session.path("metadata");
        return SubscriptionLifecycleEvent.builder()
                .eventId(eventId)
                .rawType(rawType)
                .createdAt(createdAt)
                .type(ProcessorEventType.CHECKOUT_COMPLETED)
                .externalSubscriptionId(subscription.asText())
                .externalCustomerId(optionalText(session, "customer"))
                .status("active")
                .metadataUserId(optionalLong(metadata, "userId"))
                .metadataPlanId(optionalText(metadata, "planId"))
                .metadataBillingCycle(optionalText(metadata, "billingCycle"))
                .build();
    }

    private SubscriptionLifecycleEvent parseSubscription(String eventId, String rawType, Instant createdAt,
                                                         ProcessorEventType type, JsonNode subscription,
                                                         JsonNode session) {
        JsonNode metadata = subscription.path("metadata");
        JsonNode sessionMetadata = session == null ? null : session.path("metadata");
        JsonNode price = subscription.path("price");

        String customer = optionalText(subscription, "customer");
        if (customer == null && session != null) {
            customer = optionalText(session, "customer");
        }

        return SubscriptionLifecycleEvent.builder()
                .eventId(eventId)
                .rawType(rawType)
                .createdAt(createdAt)
                .type(type)
                .externalSubscriptionId(requiredText(subscription, "id"))
                .externalCustomerId(customer)
                .status(optionalText(subscription, "status"))
                .currentPeriodStart(optionalEpoch(subscription, "current_period_start"))
                .currentPeriodEnd(optionalEpoch(subscription, "current_period_end"))
                .cancelAtPeriodEnd(subscription.path("cancel_at_period_end").asBoolean(false))
                .metadataUserId(firstLong(sessionMetadata, metadata, "userId"))
                .metadataPlanId(firstText(sessionMetadata, metadata, "planId"))
                .metadataBillingCycle(firstText(sessionMetadata, metadata, "billingCycle"))
                .priceId(optionalText(price, "id"))
                .productName(optionalText(price, "product_name"))
                .interval(optionalText(price.path("recurring"), "interval"))
                .build();
    }

    private String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            throw new ValidationException(ErrorCode.MALFORMED_EVENT, "필수 필드 누락 - " + field);
        }
        return value;
    }

    private String optionalText(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private Long optionalLong(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            // 같은 프로세서 계정을 쓰는 다른 시스템의 이벤트일 수 있으므로 값이 없는 것으로 취급
            log.warn("[ProcessorEventParser] 숫자가 아닌 메타데이터 ID 무시 - field={}, value={}", field, value);
            return null;
        }
    }

    private LocalDateTime optionalEpoch(JsonNode node, String field) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        return LocalDateTime.ofEpochSecond(node.get(field).asLong(), 0, ZoneOffset.UTC);
    }

    private String firstText(JsonNode primary, JsonNode fallback, String field) {
        String value = optionalText(primary, field);
        return value != null ? value : optionalText(fallback, field);
    }

    private Long firstLong(JsonNode primary, JsonNode fallback, String field) {
        Long value = optionalLong(primary, field);
        return value != null ? value : optionalLong(fallback, field);
    }
}

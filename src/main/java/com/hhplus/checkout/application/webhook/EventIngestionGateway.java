package com.hhplus.checkout.application.webhook;

import com.hhplus.checkout.application.processor.ProcessorConfiguration;
import com.hhplus.checkout.application.processor.ProcessorCredentials;
import com.hhplus.checkout.application.webhook.event.ProcessorEvent;
import com.hhplus.checkout.common.exception.AuthenticityException;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.event.ProcessedEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * EventIngestionGateway - 비동기 프로세서 이벤트의 단일 진입점
 *
 * 플로우:
 * PaymentWebhookController
 *     ↓ (원문 바이트 + 서명 헤더)
 * EventIngestionGateway.ingest()
 *     ├─ 1단계: 서명 검증 (실패 시 AuthenticityException, 어떤 상태도 바꾸지 않음)
 *     ├─ 2단계: 유형별 이벤트로 파싱
 *     ├─ 3단계: 원장 조회 (이미 있으면 DUPLICATE)
 *     └─ 4단계: EventApplier 트랜잭션 (원장 INSERT + 상태 변경)
 *                └─ 동시 중복 전달로 INSERT 경쟁에 지면 DUPLICATE
 *
 * 서명 검증은 파싱보다 먼저입니다. 검증되지 않은 본문은 해석하지 않습니다.
 */
@Slf4j
@Service
public class EventIngestionGateway {

    private final WebhookSignatureVerifier signatureVerifier;
    private final ProcessorEventParser eventParser;
    private final ProcessedEventRepository processedEventRepository;
    private final EventApplier eventApplier;
    private final ProcessorConfiguration processorConfiguration;

    public EventIngestionGateway(WebhookSignatureVerifier signatureVerifier,
                                 ProcessorEventParser eventParser,
                                 ProcessedEventRepository processedEventRepository,
                                 EventApplier eventApplier,
                                 ProcessorConfiguration processorConfiguration) {
        this.signatureVerifier = signatureVerifier;
        this.eventParser = eventParser;
        this.processedEventRepository = processedEventRepository;
        this.eventApplier = eventApplier;
        this.processorConfiguration = processorConfiguration;
    }

    public IngestionResult ingest(byte[] payload, String signatureHeader) {
        ProcessorCredentials credentials = processorConfiguration.current();
        if (!credentials.hasWebhookSecret()) {
            log.warn("[EventIngestionGateway] 웹훅 시크릿 미설정으로 이벤트 거부");
            throw new AuthenticityException("웹훅 시크릿이 설정되지 않았습니다");
        }
        try {
            signatureVerifier.verify(payload, signatureHeader, credentials.getWebhookSecret());
        } catch (AuthenticityException e) {
            log.warn("[EventIngestionGateway] 서명 검증 실패 - reason={}", e.getMessage());
            throw e;
        }

        ProcessorEvent event = eventParser.parse(payload);

        if (processedEventRepository.existsByEventId(event.getEventId())) {
            log.info("[EventIngestionGateway] 중복 이벤트 - eventId={}, type={}", event.getEventId(), event.getRawType());
            return IngestionResult.DUPLICATE;
        }

        try {
            EventOutcome outcome = eventApplier.apply(event);
            return toResult(outcome);
        } catch (DuplicateEventException e) {
            log.info("[EventIngestionGateway] 동시 전달된 중복 이벤트 - eventId={}", e.getEventId());
            return IngestionResult.DUPLICATE;
        }
    }

    private IngestionResult toResult(EventOutcome outcome) {
        switch (outcome) {
            case APPLIED:
                return IngestionResult.APPLIED;
            case UNRESOLVED:
                return IngestionResult.UNRESOLVED;
            default:
                return IngestionResult.IGNORED;
        }
    }
}

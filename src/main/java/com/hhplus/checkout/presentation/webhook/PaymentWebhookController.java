package com.hhplus.checkout.presentation.webhook;

import com.hhplus.checkout.application.webhook.EventIngestionGateway;
import com.hhplus.checkout.application.webhook.IngestionResult;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PaymentWebhookController - 결제 프로세서 이벤트 수신
 *
 * 서명은 원본 바이트 그대로 검증해야 하므로 본문을 byte[]로 받습니다.
 * 처리 결과(반영/무시/미해결/중복)와 관계없이 200으로 응답해 재전송을 멈춥니다.
 * 서명 실패와 형식 오류만 400입니다.
 */
@RestController
@RequestMapping("/webhooks")
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Processor-Signature";

    private final EventIngestionGateway eventIngestionGateway;

    public PaymentWebhookController(EventIngestionGateway eventIngestionGateway) {
        this.eventIngestionGateway = eventIngestionGateway;
    }

    @PostMapping(value = "/payments", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody byte[] payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        IngestionResult result = eventIngestionGateway.ingest(payload, signature);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("received", true);
        body.put("result", result.name());
        return ResponseEntity.ok(body);
    }
}

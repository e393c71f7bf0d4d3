package com.hhplus.checkout.presentation.settings;

import com.hhplus.checkout.application.settings.ProcessorSettingsService;
import com.hhplus.checkout.application.settings.UpdateProcessorSettingsCommand;
import com.hhplus.checkout.presentation.settings.request.UpdateProcessorSettingsRequest;
import com.hhplus.checkout.presentation.settings.response.ProcessorSettingsResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * ProcessorSettingsController - 결제 프로세서 키 관리
 *
 * - GET/PUT /admin/settings/payment: 관리자 조회/변경 (응답은 항상 마스킹)
 * - GET /settings/payment/publishable-key: 스토어프론트용 공개 키
 */
@RestController
public class ProcessorSettingsController {

    private final ProcessorSettingsService processorSettingsService;

    public ProcessorSettingsController(ProcessorSettingsService processorSettingsService) {
        this.processorSettingsService = processorSettingsService;
    }

    @GetMapping("/admin/settings/payment")
    public ResponseEntity<ProcessorSettingsResponse> getSettings() {
        return ResponseEntity.ok(ProcessorSettingsResponse.from(processorSettingsService.getSettings()));
    }

    @PutMapping("/admin/settings/payment")
    public ResponseEntity<ProcessorSettingsResponse> updateSettings(@RequestBody UpdateProcessorSettingsRequest request) {
        UpdateProcessorSettingsCommand command = new UpdateProcessorSettingsCommand(
                request.getPublishableKey(), request.getSecretKey(), request.getWebhookSecret());
        return ResponseEntity.ok(ProcessorSettingsResponse.from(processorSettingsService.update(command)));
    }

    @GetMapping("/settings/payment/publishable-key")
    public ResponseEntity<Map<String, String>> getPublishableKey() {
        return ResponseEntity.ok(Collections.singletonMap("publishable_key", processorSettingsService.getPublishableKey()));
    }
}

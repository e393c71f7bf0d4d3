package com.hhplus.checkout.presentation.settings;

import com.hhplus.checkout.application.settings.ProcessorSettingsService;
import com.hhplus.checkout.application.settings.ProcessorSettingsView;
import com.hhplus.checkout.application.settings.UpdateProcessorSettingsCommand;
import com.hhplus.checkout.common.BaseControllerTest;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProcessorSettingsController 단위 테스트")
class ProcessorSettingsControllerTest extends BaseControllerTest {

    @Mock
    private ProcessorSettingsService processorSettingsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new ProcessorSettingsController(processorSettingsService));
    }

    private ProcessorSettingsView maskedView() {
        return ProcessorSettingsView.builder()
                .publishableKey("pk_test...5678")
                .secretKey("sk_test...efgh")
                .configured(true)
                .webhookConfigured(false)
                .build();
    }

    @Test
    @DisplayName("설정 조회 - 마스킹된 키만 내려준다")
    void testGetSettings() throws Exception {
        // Given
        when(processorSettingsService.getSettings()).thenReturn(maskedView());

        // When & Then
        mockMvc.perform(get("/admin/settings/payment"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.publishable_key").value("pk_test...5678"))
                .andExpect(jsonPath("$.secret_key").value("sk_test...efgh"))
                .andExpect(jsonPath("$.is_configured").value(true))
                .andExpect(jsonPath("$.webhook_configured").value(false));
    }

    @Test
    @DisplayName("설정 변경 - 요청 값을 커맨드로 전달한다")
    void testUpdateSettings() throws Exception {
        // Given
        when(processorSettingsService.update(any(UpdateProcessorSettingsCommand.class))).thenReturn(maskedView());

        // When
        mockMvc.perform(put("/admin/settings/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret_key\":\"sk_test_abcdefgh\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secret_key").value("sk_test...efgh"));

        // Then
        ArgumentCaptor<UpdateProcessorSettingsCommand> captor = ArgumentCaptor.forClass(UpdateProcessorSettingsCommand.class);
        verify(processorSettingsService).update(captor.capture());
        assertEquals("sk_test_abcdefgh", captor.getValue().getSecretKey());
        assertNull(captor.getValue().getPublishableKey());
        assertNull(captor.getValue().getWebhookSecret());
    }

    @Test
    @DisplayName("공개 키 조회 - 성공")
    void testGetPublishableKey() throws Exception {
        // Given
        when(processorSettingsService.getPublishableKey()).thenReturn("pk_test_12345678");

        // When & Then
        mockMvc.perform(get("/settings/payment/publishable-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.publishable_key").value("pk_test_12345678"));
    }

    @Test
    @DisplayName("공개 키 조회 - 미설정이면 400")
    void testGetPublishableKey_NotConfigured() throws Exception {
        // Given
        when(processorSettingsService.getPublishableKey())
                .thenThrow(new ExternalProcessorException(ErrorCode.PROCESSOR_NOT_CONFIGURED));

        // When & Then
        mockMvc.perform(get("/settings/payment/publishable-key"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("APP_PROCESSOR_NOT_CONFIGURED"));
    }
}

package com.hhplus.checkout.application.settings;

import com.hhplus.checkout.application.processor.ProcessorConfiguration;
import com.hhplus.checkout.application.processor.ProcessorCredentials;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.settings.ProcessorCredential;
import com.hhplus.checkout.domain.settings.ProcessorCredentialRepository;
import com.hhplus.checkout.infrastructure.crypto.CredentialCipher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ProcessorSettingsServiceTest
 *
 * 테스트 대상:
 * - 변경 시 암호화 저장 + 실행 중 설정 즉시 교체
 * - 조회 응답은 마스킹
 * - 기동 시 저장된 자격 증명 복원
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProcessorSettingsService 단위 테스트")
class ProcessorSettingsServiceTest {

    private static final CredentialCipher CIPHER = new CredentialCipher("test-encryption-key");

    @Mock
    private ProcessorCredentialRepository credentialRepository;

    private ProcessorConfiguration processorConfiguration;
    private ProcessorSettingsService settingsService;

    @BeforeEach
    void setUp() {
        processorConfiguration = new ProcessorConfiguration(ProcessorCredentials.empty());
        settingsService = new ProcessorSettingsService(credentialRepository, processorConfiguration, CIPHER);
    }

    @Test
    @DisplayName("변경 - 암호화해 저장하고 실행 중인 설정을 교체한다")
    void testUpdate() {
        // Given
        when(credentialRepository.save(any(ProcessorCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ProcessorSettingsView view = settingsService.update(
                new UpdateProcessorSettingsCommand("pk_test_12345678", "sk_test_abcdefgh", null));

        // Then
        assertTrue(view.isConfigured());
        assertFalse(view.isWebhookConfigured());
        assertEquals("sk_test...efgh", view.getSecretKey());
        assertTrue(processorConfiguration.isConfigured());
        assertEquals("sk_test_abcdefgh", processorConfiguration.current().getSecretKey());

        ArgumentCaptor<ProcessorCredential> captor = ArgumentCaptor.forClass(ProcessorCredential.class);
        verify(credentialRepository).save(captor.capture());
        String stored = captor.getValue().getEncryptedSecretKey();
        assertNotEquals("sk_test_abcdefgh", stored);
        assertEquals("sk_test_abcdefgh", CIPHER.decrypt(stored));
        assertNull(captor.getValue().getEncryptedWebhookSecret());
    }

    @Test
    @DisplayName("변경 - 보내지 않은 값은 기존 값을 유지한다")
    void testUpdate_PartialKeepsExisting() {
        // Given
        processorConfiguration.reconfigure(new ProcessorCredentials("pk_test_12345678", "sk_test_abcdefgh", null));
        when(credentialRepository.save(any(ProcessorCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        settingsService.update(new UpdateProcessorSettingsCommand(null, null, "whsec_new_secret"));

        // Then
        ProcessorCredentials current = processorConfiguration.current();
        assertEquals("pk_test_12345678", current.getPublishableKey());
        assertEquals("sk_test_abcdefgh", current.getSecretKey());
        assertEquals("whsec_new_secret", current.getWebhookSecret());
    }

    @Test
    @DisplayName("변경 - 빈 문자열이나 변경 값 없음은 거부한다")
    void testUpdate_Invalid() {
        // When & Then
        assertThrows(ValidationException.class,
                () -> settingsService.update(new UpdateProcessorSettingsCommand(" ", null, null)));
        assertThrows(ValidationException.class,
                () -> settingsService.update(new UpdateProcessorSettingsCommand(null, null, null)));
        verifyNoInteractions(credentialRepository);
    }

    @Test
    @DisplayName("공개 키 조회 - 설정되지 않았으면 PROCESSOR_NOT_CONFIGURED")
    void testGetPublishableKey() {
        // When & Then
        ExternalProcessorException e = assertThrows(ExternalProcessorException.class,
                () -> settingsService.getPublishableKey());
        assertEquals(ErrorCode.PROCESSOR_NOT_CONFIGURED, e.getErrorCode());

        processorConfiguration.reconfigure(new ProcessorCredentials("pk_test_12345678", null, null));
        assertEquals("pk_test_12345678", settingsService.getPublishableKey());
    }

    @Test
    @DisplayName("기동 복원 - 저장된 자격 증명을 복호화해 적용한다")
    void testLoadStoredCredentials() {
        // Given
        when(credentialRepository.find()).thenReturn(Optional.of(ProcessorCredential.of(
                CIPHER.encrypt("pk_test_12345678"), CIPHER.encrypt("sk_test_abcdefgh"), CIPHER.encrypt("whsec_stored"))));

        // When
        boolean loaded = settingsService.loadStoredCredentials();

        // Then
        assertTrue(loaded);
        assertTrue(processorConfiguration.isConfigured());
        assertEquals("whsec_stored", processorConfiguration.current().getWebhookSecret());
    }
}

package com.hhplus.checkout.application.settings;

import com.hhplus.checkout.common.exception.SystemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 기동 시 저장된 프로세서 자격 증명 로드
 *
 * 복호화에 실패하면(암호화 키 변경 등) application.yml 값으로 계속 기동합니다.
 */
@Slf4j
@Component
public class ProcessorSettingsBootstrap implements ApplicationRunner {

    private final ProcessorSettingsService processorSettingsService;

    public ProcessorSettingsBootstrap(ProcessorSettingsService processorSettingsService) {
        this.processorSettingsService = processorSettingsService;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            boolean loaded = processorSettingsService.loadStoredCredentials();
            log.info("[ProcessorSettingsBootstrap] 저장된 자격 증명 로드 - loaded={}", loaded);
        } catch (SystemException e) {
            log.error("[ProcessorSettingsBootstrap] 저장된 자격 증명 복호화 실패, 설정 파일 값 사용", e);
        }
    }
}

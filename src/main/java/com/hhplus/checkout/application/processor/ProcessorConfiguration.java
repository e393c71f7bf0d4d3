package com.hhplus.checkout.application.processor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 결제 프로세서 설정 홀더
 *
 * 프로세서 클라이언트와 웹훅 게이트웨이가 생성 시점에 주입받아 매 호출마다 current()를 읽습니다.
 * 관리자가 키를 바꾸면 reconfigure()로 즉시 교체되며, 지연 생성되는 전역 클라이언트는 두지 않습니다.
 *
 * 초기값은 application.yml의 checkout.processor.* 이며,
 * 저장된 암호화 자격 증명이 있으면 기동 시 ProcessorSettingsBootstrap이 덮어씁니다.
 */
@Slf4j
@Component
public class ProcessorConfiguration {

    private final AtomicReference<ProcessorCredentials> current;

    @Autowired
    public ProcessorConfiguration(@Value("${checkout.processor.publishable-key:}") String publishableKey,
                                  @Value("${checkout.processor.secret-key:}") String secretKey,
                                  @Value("${checkout.processor.webhook-secret:}") String webhookSecret) {
        this.current = new AtomicReference<>(new ProcessorCredentials(publishableKey, secretKey, webhookSecret));
    }

    public ProcessorConfiguration(ProcessorCredentials initial) {
        this.current = new AtomicReference<>(initial);
    }

    public ProcessorCredentials current() {
        return current.get();
    }

    public void reconfigure(ProcessorCredentials credentials) {
        ProcessorCredentials previous = current.getAndSet(credentials);
        log.info("[ProcessorConfiguration] 결제 프로세서 설정 교체 - before={}, after={}", previous, credentials);
    }

    public boolean isConfigured() {
        return current.get().isConfigured();
    }
}

package com.hhplus.checkout.infrastructure.processor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 결제 프로세서 HTTP 클라이언트 설정
 *
 * 모든 호출에 연결/읽기 타임아웃을 둡니다. 타임아웃은 실패로 취급됩니다.
 */
@Configuration
public class ProcessorClientConfig {

    @Bean
    public RestTemplate processorRestTemplate(
            @Value("${checkout.processor.connect-timeout-ms:2000}") int connectTimeoutMs,
            @Value("${checkout.processor.read-timeout-ms:5000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}

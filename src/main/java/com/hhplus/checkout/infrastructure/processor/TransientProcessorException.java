package com.hhplus.checkout.infrastructure.processor;

/**
 * 재시도 대상 프로세서 오류 (I/O 오류, 타임아웃, 5xx)
 *
 * HttpPaymentProcessorClient 밖으로 나가지 않습니다. 재시도가 끝나면 ExternalProcessorException으로 변환됩니다.
 */
public class TransientProcessorException extends RuntimeException {

    public TransientProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}

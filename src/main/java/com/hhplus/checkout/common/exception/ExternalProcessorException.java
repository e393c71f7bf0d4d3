package com.hhplus.checkout.common.exception;

/**
 * 결제 프로세서 호출 실패 (400)
 *
 * 프로세서가 돌려준 메시지를 그대로 사용자에게 노출합니다.
 */
public class ExternalProcessorException extends ApplicationException {

    private final String processorMessage;

    public ExternalProcessorException(String processorMessage) {
        super(ErrorCode.PROCESSOR_REQUEST_FAILED, processorMessage);
        this.processorMessage = processorMessage;
    }

    public ExternalProcessorException(String processorMessage, Throwable cause) {
        super(ErrorCode.PROCESSOR_REQUEST_FAILED, processorMessage, cause);
        this.processorMessage = processorMessage;
    }

    public ExternalProcessorException(ErrorCode errorCode) {
        super(errorCode);
        this.processorMessage = errorCode.getMessage();
    }

    public String getProcessorMessage() {
        return processorMessage;
    }
}

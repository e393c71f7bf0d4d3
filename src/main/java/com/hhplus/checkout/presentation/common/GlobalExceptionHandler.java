package com.hhplus.checkout.presentation.common;

import com.hhplus.checkout.common.exception.BizException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.common.exception.SystemException;
import com.hhplus.checkout.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CART_EMPTY",
 *   "error_message": "장바구니가 비어 있습니다",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 코드
 * - ExternalProcessorException: 400, 프로세서 메시지를 그대로 노출
 * - 400 Bad Request: IllegalArgumentException, 읽을 수 없는 본문, 필수 헤더 누락
 * - 500 Internal Server Error: 그 외 모든 예외
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 결제 프로세서 호출 실패 (400)
     */
    @ExceptionHandler(ExternalProcessorException.class)
    public ResponseEntity<ErrorResponse> handleExternalProcessorException(ExternalProcessorException e) {
        logger.warn("[GlobalExceptionHandler] 프로세서 요청 실패 - code={}, message={}",
                e.getErrorCodeValue(), e.getProcessorMessage());
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getProcessorMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 시스템 오류 (5XX). 내부 메시지는 노출하지 않습니다.
     */
    @ExceptionHandler(SystemException.class)
    public ResponseEntity<ErrorResponse> handleSystemException(SystemException e) {
        logger.error("[GlobalExceptionHandler] 시스템 오류 - code={}", e.getErrorCodeValue(), e);
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getErrorCode().getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 도메인/애플리케이션 예외 (ErrorCode의 상태 코드)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] 처리 실패 - code={}", e.getErrorCodeValue(), e);
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 잘못된 요청 파라미터 (400)
     *
     * 금액 형식 오류, 통화 불일치, 잘못된 사용자 ID 등
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(),
                ErrorCode.INVALID_REQUEST.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR.getCode(), "서버 오류가 발생했습니다");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}

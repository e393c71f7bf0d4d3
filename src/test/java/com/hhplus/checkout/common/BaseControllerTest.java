package com.hhplus.checkout.common;

import com.hhplus.checkout.presentation.common.GlobalExceptionHandler;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * BaseControllerTest - Controller 계층 테스트 기본 클래스
 *
 * - spring.web.resources.add-mappings=false로 정적 리소스 매핑 비활성화
 * - standaloneSetup + GlobalExceptionHandler로 에러 응답 형식까지 검증
 *
 * 경로 접두사(/api)는 AppConfig에서 붙으므로 standalone 테스트는 접두사 없는 경로를 사용합니다.
 */
@TestPropertySource(properties = {
    "spring.web.resources.add-mappings=false"
})
public abstract class BaseControllerTest {

    protected MockMvc buildMockMvc(Object controller) {
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
}

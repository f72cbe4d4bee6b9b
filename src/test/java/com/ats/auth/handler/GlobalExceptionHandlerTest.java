package com.ats.auth.handler;

import com.ats.shared.dto.ErrorResponse;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.InternalServerErrorException;
import com.ats.shared.exception.NotFoundException;
import org.junit.jupiter.api.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * GlobalExceptionHandler 單元測試
 *
 * 覆蓋：ApiException 狀態碼與錯誤碼、權限、未登入
 */
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Nested
    @DisplayName("ApiException")
    class ApiExceptionTests {

        @Test
        @DisplayName("BadRequest：400 + 錯誤碼")
        void badRequest() {
            ResponseEntity<ErrorResponse> response = handler.handleApi(
                    new BadRequestException(ErrorCode.INVALID_SIGNATURE, "Invalid webhook signature"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody().getCode()).isEqualTo("INVALID_SIGNATURE");
            assertThat(response.getBody().getMessage()).isEqualTo("Invalid webhook signature");
            assertThat(response.getBody().getError()).isEqualTo("Bad Request");
        }

        @Test
        @DisplayName("NotFound：404")
        void notFound() {
            ResponseEntity<ErrorResponse> response = handler.handleApi(
                    new NotFoundException(ErrorCode.PLAN_NOT_FOUND, "Plan not found: 9"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(response.getBody().getCode()).isEqualTo("PLAN_NOT_FOUND");
        }

        @Test
        @DisplayName("InternalServerError：500，不帶 cause 訊息")
        void internalError() {
            ResponseEntity<ErrorResponse> response = handler.handleApi(new InternalServerErrorException(
                    ErrorCode.CHECKOUT_FAILED, "Failed to create checkout", new RuntimeException("HTTP 500 from provider")));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody().getMessage()).isEqualTo("Failed to create checkout");
        }
    }

    @Test
    @DisplayName("AccessDenied：403")
    void accessDenied() {
        ResponseEntity<Map<String, String>> response =
                handler.handleAccessDenied(new AccessDeniedException("需要管理員權限"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    @DisplayName("未登入：401，其他 IllegalStateException：500")
    void illegalState() {
        assertThat(handler.handleIllegalState(new IllegalStateException("用戶未登入")).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(handler.handleIllegalState(new IllegalStateException("other")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}

package com.ats.payment.service;

import com.ats.payment.config.PaymentConfig;
import com.ats.payment.dto.*;
import com.ats.payment.gateway.PaymentGateway;
import com.ats.payment.gateway.WebhookSignatureVerifier;
import com.ats.payment.gateway.lemonsqueezy.LemonSqueezyApiException;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.InternalServerErrorException;
import com.ats.shared.exception.NotFoundException;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * PaymentService 單元測試
 *
 * 覆蓋：錯誤種類轉換、webhook 簽名（有/無驗證能力、放行設定）、health check
 */
class PaymentServiceTest {

    /** 同時具備簽名驗證能力的供應商 */
    interface VerifyingGateway extends PaymentGateway, WebhookSignatureVerifier {
    }

    private VerifyingGateway gateway;
    private PaymentService paymentService;

    @BeforeEach
    void setUp() {
        gateway = mock(VerifyingGateway.class);
        when(gateway.getProviderName()).thenReturn("LemonSqueezy");
        paymentService = new PaymentService(gateway, paymentConfig(true));
    }

    private static PaymentConfig paymentConfig(boolean allowUnverified) {
        return new PaymentConfig("lemonsqueezy", null, new PaymentConfig.Webhook(allowUnverified));
    }

    @Nested
    @DisplayName("錯誤轉換")
    class ErrorMappingTests {

        @Test
        @DisplayName("建立結帳失敗：CHECKOUT_FAILED")
        void checkoutFailure() {
            when(gateway.createCheckout(any())).thenThrow(new LemonSqueezyApiException(500, "boom"));

            assertThatThrownBy(() -> paymentService.createCheckout(CheckoutRequest.builder().variantId("1").build()))
                    .isInstanceOf(InternalServerErrorException.class)
                    .hasMessage("Failed to create checkout")
                    .extracting("code").isEqualTo(ErrorCode.CHECKOUT_FAILED);
        }

        @Test
        @DisplayName("建立結帳的 BadRequest 原樣往上拋")
        void checkoutBadRequestPassesThrough() {
            when(gateway.createCheckout(any()))
                    .thenThrow(new BadRequestException(ErrorCode.INVALID_VARIANT, "variantId is required"));

            assertThatThrownBy(() -> paymentService.createCheckout(CheckoutRequest.builder().build()))
                    .isInstanceOf(BadRequestException.class)
                    .extracting("code").isEqualTo(ErrorCode.INVALID_VARIANT);
        }

        @Test
        @DisplayName("查詢訂閱失敗：NotFound")
        void subscriptionLookupFailure() {
            when(gateway.getSubscription("sub_1")).thenThrow(new LemonSqueezyApiException(0, "io"));

            assertThatThrownBy(() -> paymentService.getSubscription("sub_1"))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo(ErrorCode.SUBSCRIPTION_NOT_FOUND);
        }

        @Test
        @DisplayName("取消失敗：CANCELLATION_FAILED")
        void cancelFailure() {
            when(gateway.cancelSubscription(any())).thenThrow(new LemonSqueezyApiException(500, "x"));

            assertThatThrownBy(() -> paymentService.cancelSubscription(
                    CancelSubscriptionRequest.builder().subscriptionId("sub_1").build()))
                    .isInstanceOf(InternalServerErrorException.class)
                    .extracting("code").isEqualTo(ErrorCode.CANCELLATION_FAILED);
        }

        @Test
        @DisplayName("portal 失敗：PORTAL_FAILED")
        void portalFailure() {
            when(gateway.createCustomerPortal(anyString(), any())).thenThrow(new LemonSqueezyApiException(404, "x"));

            assertThatThrownBy(() -> paymentService.createCustomerPortal("1001", null))
                    .isInstanceOf(InternalServerErrorException.class)
                    .extracting("code").isEqualTo(ErrorCode.PORTAL_FAILED);
        }
    }

    @Nested
    @DisplayName("Webhook 簽名")
    class SignatureTests {

        @Test
        @DisplayName("委派給供應商驗證")
        void delegatesToVerifier() {
            when(gateway.verifyWebhookSignature("sig", "body")).thenReturn(true);

            assertThat(paymentService.verifyWebhookSignature("sig", "body")).isTrue();
        }

        @Test
        @DisplayName("簽名不符：false")
        void mismatch() {
            when(gateway.verifyWebhookSignature("bad", "body")).thenReturn(false);

            assertThat(paymentService.verifyWebhookSignature("bad", "body")).isFalse();
        }

        @Test
        @DisplayName("驗證拋例外：false")
        void verifierThrows() {
            when(gateway.verifyWebhookSignature(any(), any())).thenThrow(new IllegalStateException("x"));

            assertThat(paymentService.verifyWebhookSignature("sig", "body")).isFalse();
        }

        @Test
        @DisplayName("供應商無驗證能力 + 允許：放行")
        void noVerifierAllowed() {
            PaymentGateway plain = mock(PaymentGateway.class);
            PaymentService service = new PaymentService(plain, paymentConfig(true));

            assertThat(service.verifyWebhookSignature(null, "body")).isTrue();
        }

        @Test
        @DisplayName("供應商無驗證能力 + 不允許：拒絕")
        void noVerifierRejected() {
            PaymentGateway plain = mock(PaymentGateway.class);
            PaymentService service = new PaymentService(plain, paymentConfig(false));

            assertThat(service.verifyWebhookSignature("sig", "body")).isFalse();
        }
    }

    @Nested
    @DisplayName("Health check")
    class HealthTests {

        @Test
        @DisplayName("連線成功：healthy")
        void healthy() {
            when(gateway.testConnection()).thenReturn(true);

            ProviderHealthResponse health = paymentService.healthCheck();

            assertThat(health.getStatus()).isEqualTo("healthy");
            assertThat(health.getProvider()).isEqualTo("LemonSqueezy");
        }

        @Test
        @DisplayName("連線拋例外：unhealthy")
        void throwsUnhealthy() {
            when(gateway.testConnection()).thenThrow(new RuntimeException("down"));

            assertThat(paymentService.healthCheck().getStatus()).isEqualTo("unhealthy");
        }
    }
}

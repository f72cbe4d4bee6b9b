package com.ats.payment.gateway;

import com.ats.payment.config.LemonSqueezyConfig;
import com.ats.payment.config.PaymentConfig;
import com.ats.payment.gateway.lemonsqueezy.LemonSqueezyPaymentGateway;
import com.ats.payment.model.PaymentProvider;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.InternalServerErrorException;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * PaymentGatewayFactory 單元測試
 *
 * 覆蓋：名稱正規化、未實作供應商、未知供應商、缺少憑證
 */
class PaymentGatewayFactoryTest {

    private OkHttpClient httpClient;
    private LemonSqueezyConfig lemonSqueezyConfig;

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        lemonSqueezyConfig = new LemonSqueezyConfig("ls-key", "12345", "whsec",
                "https://api.lemonsqueezy.com/v1", true);
    }

    private PaymentGatewayFactory factory(String provider) {
        PaymentConfig paymentConfig = new PaymentConfig(provider, "https://app.test/billing/success",
                new PaymentConfig.Webhook(true));
        return new PaymentGatewayFactory(paymentConfig, lemonSqueezyConfig, httpClient);
    }

    @Nested
    @DisplayName("建立供應商")
    class CreateTests {

        @Test
        @DisplayName("lemonsqueezy 建立 Lemon Squeezy 實作")
        void createsLemonSqueezy() {
            PaymentGateway gateway = factory("lemonsqueezy").create();

            assertThat(gateway).isInstanceOf(LemonSqueezyPaymentGateway.class);
            assertThat(gateway).isInstanceOf(WebhookSignatureVerifier.class);
            assertThat(gateway.getProviderName()).isEqualTo("LemonSqueezy");
        }

        @Test
        @DisplayName("名稱不分大小寫且忽略前後空白")
        void caseInsensitive() {
            assertThat(factory(" LemonSqueezy ").create()).isInstanceOf(LemonSqueezyPaymentGateway.class);
            assertThat(factory("LEMONSQUEEZY").getActiveProvider()).isEqualTo(PaymentProvider.LEMONSQUEEZY);
        }

        @Test
        @DisplayName("stripe 尚未實作")
        void stripeNotImplemented() {
            assertThatThrownBy(() -> factory("stripe").create())
                    .isInstanceOf(InternalServerErrorException.class)
                    .hasMessage("Stripe payment gateway not implemented yet")
                    .extracting("code").isEqualTo(ErrorCode.PROVIDER_NOT_IMPLEMENTED);
        }

        @Test
        @DisplayName("paddle / paypal 尚未實作")
        void otherProvidersNotImplemented() {
            assertThatThrownBy(() -> factory("paddle").create())
                    .isInstanceOf(InternalServerErrorException.class)
                    .hasMessageContaining("Paddle");
            assertThatThrownBy(() -> factory("paypal").create())
                    .isInstanceOf(InternalServerErrorException.class)
                    .hasMessageContaining("PayPal");
        }

        @Test
        @DisplayName("未知供應商：訊息列出支援清單")
        void unknownProvider() {
            assertThatThrownBy(() -> factory("square").create())
                    .isInstanceOf(BadRequestException.class)
                    .hasMessage("Invalid payment provider in configuration: square. "
                            + "Supported providers: lemonsqueezy, stripe, paddle, paypal")
                    .extracting("code").isEqualTo(ErrorCode.UNKNOWN_PROVIDER);
        }

        @Test
        @DisplayName("缺少 webhook secret 時啟動失敗")
        void missingCredentialFailsFast() {
            lemonSqueezyConfig = new LemonSqueezyConfig("ls-key", "12345", "",
                    "https://api.lemonsqueezy.com/v1", false);

            assertThatThrownBy(() -> factory("lemonsqueezy").create())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("lemonsqueezy.webhook-secret");
        }
    }

    @Test
    @DisplayName("支援清單依固定順序")
    void supportedProviders() {
        assertThat(factory("lemonsqueezy").getSupportedProviders())
                .containsExactly("lemonsqueezy", "stripe", "paddle", "paypal");
    }
}

package com.ats.payment.gateway.lemonsqueezy;

import com.ats.payment.config.LemonSqueezyConfig;
import com.ats.payment.dto.*;
import com.ats.payment.model.SubscriptionStatus;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.NotFoundException;
import com.ats.shared.util.HmacSignatureUtil;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import okhttp3.*;
import okio.Buffer;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * LemonSqueezyPaymentGateway 單元測試
 *
 * 覆蓋：結帳 body 組裝、HTTP 錯誤映射、訂閱查詢、取消、portal、狀態正規化、webhook 簽名
 */
class LemonSqueezyPaymentGatewayTest {

    private static final String WEBHOOK_SECRET = "whsec_test";

    private OkHttpClient httpClient;
    private Call mockCall;
    private LemonSqueezyPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        mockCall = mock(Call.class);
        when(httpClient.newCall(any())).thenReturn(mockCall);

        LemonSqueezyConfig config = new LemonSqueezyConfig("ls-api-key", "777", WEBHOOK_SECRET,
                "https://api.lemonsqueezy.com/v1/", true);
        gateway = new LemonSqueezyPaymentGateway(httpClient, config, "https://app.test/billing/success");
    }

    @Nested
    @DisplayName("建立結帳頁")
    class CheckoutTests {

        @Test
        @DisplayName("成功：回傳結帳網址與 ID")
        void createsCheckout() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(201, """
                    {"data":{"type":"checkouts","id":"chk_1","attributes":{
                      "url":"https://store.lemonsqueezy.com/checkout/custom/abc",
                      "expires_at":null}}}
                    """));

            CheckoutResponse response = gateway.createCheckout(CheckoutRequest.builder()
                    .variantId("42")
                    .customerEmail("a@b.com")
                    .customData(Map.of("user_id", "u1"))
                    .build());

            assertThat(response.getCheckoutUrl()).isEqualTo("https://store.lemonsqueezy.com/checkout/custom/abc");
            assertThat(response.getCheckoutId()).isEqualTo("chk_1");
            assertThat(response.getProvider()).isEqualTo("LemonSqueezy");
            assertThat(response.getExpiresAt()).isNull();
        }

        @Test
        @DisplayName("請求打到 /checkouts 並帶 Bearer API key")
        void requestShape() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(201,
                    "{\"data\":{\"id\":\"chk_1\",\"attributes\":{\"url\":\"https://x\"}}}"));

            gateway.createCheckout(CheckoutRequest.builder().variantId("42").build());

            ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
            verify(httpClient).newCall(captor.capture());
            Request request = captor.getValue();
            assertThat(request.url().toString()).isEqualTo("https://api.lemonsqueezy.com/v1/checkouts");
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.header("Authorization")).isEqualTo("Bearer ls-api-key");

            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            JsonObject data = JsonParser.parseString(buffer.readUtf8()).getAsJsonObject().getAsJsonObject("data");
            assertThat(data.get("type").getAsString()).isEqualTo("checkouts");
        }

        @Test
        @DisplayName("body：custom data、redirect、store/variant relationships")
        void checkoutBody() {
            String body = gateway.buildCheckoutBody(CheckoutRequest.builder()
                    .variantId("42")
                    .customerEmail("a@b.com")
                    .customerName("Ann")
                    .customData(Map.of("user_id", "u1", "plan_id", "3"))
                    .build());

            JsonObject data = JsonParser.parseString(body).getAsJsonObject().getAsJsonObject("data");
            JsonObject attributes = data.getAsJsonObject("attributes");
            JsonObject checkoutData = attributes.getAsJsonObject("checkout_data");
            assertThat(checkoutData.get("email").getAsString()).isEqualTo("a@b.com");
            assertThat(checkoutData.get("name").getAsString()).isEqualTo("Ann");
            assertThat(checkoutData.getAsJsonObject("custom").get("user_id").getAsString()).isEqualTo("u1");
            assertThat(checkoutData.getAsJsonObject("custom").get("plan_id").getAsString()).isEqualTo("3");

            JsonObject productOptions = attributes.getAsJsonObject("product_options");
            assertThat(productOptions.get("redirect_url").getAsString()).isEqualTo("https://app.test/billing/success");
            assertThat(productOptions.get("receipt_button_text").getAsString()).isEqualTo("Go to Dashboard");
            assertThat(attributes.get("test_mode").getAsBoolean()).isTrue();

            JsonObject relationships = data.getAsJsonObject("relationships");
            assertThat(relationships.getAsJsonObject("store").getAsJsonObject("data").get("id").getAsString())
                    .isEqualTo("777");
            assertThat(relationships.getAsJsonObject("variant").getAsJsonObject("data").get("id").getAsString())
                    .isEqualTo("42");
        }

        @Test
        @DisplayName("variantId 空白：BadRequest，不發請求")
        void blankVariant() {
            assertThatThrownBy(() -> gateway.createCheckout(CheckoutRequest.builder().variantId(" ").build()))
                    .isInstanceOf(BadRequestException.class);
            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("HTTP 422：LemonSqueezyApiException 帶狀態碼")
        void httpError() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(422, "{\"errors\":[{\"detail\":\"bad\"}]}"));

            assertThatThrownBy(() -> gateway.createCheckout(CheckoutRequest.builder().variantId("42").build()))
                    .isInstanceOf(LemonSqueezyApiException.class)
                    .hasMessage("createCheckout failed: HTTP 422")
                    .extracting("statusCode").isEqualTo(422);
        }

        @Test
        @DisplayName("IO 例外：狀態碼 0")
        void ioError() throws Exception {
            when(mockCall.execute()).thenThrow(new IOException("timeout"));

            assertThatThrownBy(() -> gateway.createCheckout(CheckoutRequest.builder().variantId("42").build()))
                    .isInstanceOf(LemonSqueezyApiException.class)
                    .extracting("statusCode").isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("訂閱")
    class SubscriptionTests {

        @Test
        @DisplayName("查詢訂閱：金額、狀態、期間")
        void getSubscription() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"data":{"type":"subscriptions","id":"sub_9","attributes":{
                      "status":"on_trial","variant_id":42,"customer_id":1001,
                      "first_subscription_item":{"price":1999},
                      "created_at":"2024-05-01T00:00:00.000000Z",
                      "renews_at":"2024-06-01T00:00:00.000000Z",
                      "ends_at":null,"cancelled":false}}}
                    """));

            SubscriptionInfo info = gateway.getSubscription("sub_9");

            assertThat(info.getId()).isEqualTo("sub_9");
            assertThat(info.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(info.getPlanId()).isEqualTo("42");
            assertThat(info.getCustomerId()).isEqualTo("1001");
            assertThat(info.getAmount()).isEqualByComparingTo(new BigDecimal("19.99"));
            assertThat(info.getCurrentPeriodEnd()).isNotNull();
            assertThat(info.isCancelAtPeriodEnd()).isFalse();
        }

        @Test
        @DisplayName("查詢訂閱 404：NotFoundException")
        void subscriptionNotFound() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(404, "{\"errors\":[]}"));

            assertThatThrownBy(() -> gateway.getSubscription("missing"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("取消：DELETE /subscriptions/{id}，回傳 ends_at")
        void cancel() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"data":{"id":"sub_9","attributes":{"status":"cancelled",
                      "ends_at":"2024-06-01T00:00:00.000000Z"}}}
                    """));

            CancelSubscriptionResponse response = gateway.cancelSubscription(
                    CancelSubscriptionRequest.builder().subscriptionId("sub_9").build());

            assertThat(response.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
            assertThat(response.getEndsAt()).isNotNull();
            assertThat(response.getCancelledAt()).isNotNull();

            ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
            verify(httpClient).newCall(captor.capture());
            assertThat(captor.getValue().method()).isEqualTo("DELETE");
            assertThat(captor.getValue().url().encodedPath()).isEqualTo("/v1/subscriptions/sub_9");
        }

        @Test
        @DisplayName("customer portal：取 urls.customer_portal")
        void customerPortal() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"data":{"id":"1001","attributes":{"urls":{
                      "customer_portal":"https://store.lemonsqueezy.com/billing?sig=x"}}}}
                    """));

            CustomerPortalResponse response = gateway.createCustomerPortal("1001", null);

            assertThat(response.getPortalUrl()).isEqualTo("https://store.lemonsqueezy.com/billing?sig=x");
            assertThat(response.getExpiresAt()).isNotNull();
        }

        @Test
        @DisplayName("依 customer 查詢訂閱：回傳空列表，不發請求")
        void customerSubscriptionsUnsupported() {
            assertThat(gateway.getCustomerSubscriptions("1001")).isEmpty();
            verify(httpClient, never()).newCall(any());
        }
    }

    @Nested
    @DisplayName("狀態正規化")
    class StatusTests {

        @Test
        @DisplayName("已知狀態對應")
        void knownStatuses() {
            assertThat(gateway.normalizeStatus("active")).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(gateway.normalizeStatus("cancelled")).isEqualTo(SubscriptionStatus.CANCELLED);
            assertThat(gateway.normalizeStatus("expired")).isEqualTo(SubscriptionStatus.EXPIRED);
            assertThat(gateway.normalizeStatus("paused")).isEqualTo(SubscriptionStatus.PAUSED);
            assertThat(gateway.normalizeStatus("past_due")).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(gateway.normalizeStatus("unpaid")).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(gateway.normalizeStatus("ON_TRIAL")).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("未知或 null：ACTIVE")
        void unknownStatus() {
            assertThat(gateway.normalizeStatus("frozen")).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(gateway.normalizeStatus(null)).isEqualTo(SubscriptionStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("Webhook 簽名")
    class SignatureTests {

        private static final String BODY = "{\"meta\":{\"event_name\":\"subscription_created\"}}";

        @Test
        @DisplayName("正確簽名通過")
        void valid() {
            String signature = HmacSignatureUtil.sign(BODY, WEBHOOK_SECRET);

            assertThat(gateway.verifyWebhookSignature(signature, BODY)).isTrue();
        }

        @Test
        @DisplayName("缺少或錯誤簽名不通過")
        void invalid() {
            assertThat(gateway.verifyWebhookSignature(null, BODY)).isFalse();
            assertThat(gateway.verifyWebhookSignature("deadbeef", BODY)).isFalse();
        }
    }

    @Nested
    @DisplayName("連線測試")
    class ConnectionTests {

        @Test
        @DisplayName("GET /users/me 成功")
        void reachable() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"data\":{\"id\":\"1\"}}"));

            assertThat(gateway.testConnection()).isTrue();
        }

        @Test
        @DisplayName("401：回傳 false，不拋例外")
        void unauthorized() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(401, "{}"));

            assertThat(gateway.testConnection()).isFalse();
        }
    }

    private Response buildResponse(int code, String body) {
        return new Response.Builder()
                .request(new Request.Builder().url("https://api.lemonsqueezy.com/v1").build())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("OK")
                .body(ResponseBody.create(body, MediaType.get("application/vnd.api+json")))
                .build();
    }
}

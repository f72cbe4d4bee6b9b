package com.ats.payment.gateway.lemonsqueezy;

import com.ats.payment.config.LemonSqueezyConfig;
import com.ats.payment.dto.*;
import com.ats.payment.gateway.PaymentGateway;
import com.ats.payment.gateway.WebhookSignatureVerifier;
import com.ats.payment.model.SubscriptionStatus;
import com.ats.shared.config.AppConstants;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.NotFoundException;
import com.ats.shared.util.DateTimeUtil;
import com.ats.shared.util.HmacSignatureUtil;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lemon Squeezy REST API 實作
 *
 * 直接透過 OkHttp 呼叫 JSON:API 端點，不引入 SDK。
 * 所有憑證在建構時檢查，缺任何一個就丟 IllegalStateException，
 * 讓應用在啟動階段失敗，而不是第一筆請求才失敗。
 *
 * API 文件：https://docs.lemonsqueezy.com/api
 */
@Slf4j
public class LemonSqueezyPaymentGateway implements PaymentGateway, WebhookSignatureVerifier {

    public static final String PROVIDER_NAME = "LemonSqueezy";

    private static final MediaType JSON_API = MediaType.get("application/vnd.api+json");
    private static final long PORTAL_TTL_HOURS = 24;

    /** Lemon Squeezy 訂閱狀態 → 內部狀態 */
    static final Map<String, SubscriptionStatus> STATUS_MAP = Map.of(
            "active", SubscriptionStatus.ACTIVE,
            "on_trial", SubscriptionStatus.ACTIVE,
            "cancelled", SubscriptionStatus.CANCELLED,
            "expired", SubscriptionStatus.EXPIRED,
            "paused", SubscriptionStatus.PAUSED,
            "past_due", SubscriptionStatus.PAST_DUE,
            "unpaid", SubscriptionStatus.PAST_DUE
    );

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final String storeId;
    private final String webhookSecret;
    private final boolean testMode;
    private final String defaultRedirectUrl;
    private final Gson gson = new Gson();

    public LemonSqueezyPaymentGateway(OkHttpClient httpClient, LemonSqueezyConfig config,
                                      String defaultRedirectUrl) {
        this.httpClient = httpClient;
        this.apiKey = requireConfigured(config.getApiKey(), "lemonsqueezy.api-key");
        this.storeId = requireConfigured(config.getStoreId(), "lemonsqueezy.store-id");
        this.webhookSecret = requireConfigured(config.getWebhookSecret(), "lemonsqueezy.webhook-secret");
        this.baseUrl = stripTrailingSlash(config.getBaseUrl());
        this.testMode = config.isTestMode();
        this.defaultRedirectUrl = defaultRedirectUrl;
        log.info("Lemon Squeezy 已初始化: storeId={}, testMode={}", storeId, testMode);
    }

    // ===================== 結帳 =====================

    @Override
    public CheckoutResponse createCheckout(CheckoutRequest request) {
        if (request.getVariantId() == null || request.getVariantId().isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_VARIANT, "variantId is required");
        }

        Request httpRequest = newRequest("/checkouts")
                .post(RequestBody.create(buildCheckoutBody(request), JSON_API))
                .build();

        JsonObject data = requireData(execute(httpRequest, "createCheckout"), "createCheckout");
        JsonObject attributes = data.getAsJsonObject("attributes");

        String checkoutUrl = string(attributes, "url");
        if (checkoutUrl == null) {
            throw new LemonSqueezyApiException(200, "checkout response has no url");
        }

        log.info("Lemon Squeezy 結帳頁已建立: checkoutId={}, variantId={}",
                string(data, "id"), request.getVariantId());

        return CheckoutResponse.builder()
                .checkoutUrl(checkoutUrl)
                .checkoutId(string(data, "id"))
                .provider(PROVIDER_NAME)
                .expiresAt(DateTimeUtil.parseIso(string(attributes, "expires_at")))
                .build();
    }

    /**
     * 建構 POST /checkouts body
     *
     * {
     *   "data": {
     *     "type": "checkouts",
     *     "attributes": {
     *       "checkout_data": { "email": "...", "name": "...", "custom": {...} },
     *       "product_options": { "redirect_url": "...", "receipt_button_text": "Go to Dashboard" },
     *       "test_mode": false
     *     },
     *     "relationships": {
     *       "store":   { "data": { "type": "stores",   "id": "..." } },
     *       "variant": { "data": { "type": "variants", "id": "..." } }
     *     }
     *   }
     * }
     */
    String buildCheckoutBody(CheckoutRequest request) {
        JsonObject custom = new JsonObject();
        if (request.getCustomData() != null) {
            request.getCustomData().forEach(custom::addProperty);
        }

        JsonObject checkoutData = new JsonObject();
        if (request.getCustomerEmail() != null) {
            checkoutData.addProperty("email", request.getCustomerEmail());
        }
        if (request.getCustomerName() != null) {
            checkoutData.addProperty("name", request.getCustomerName());
        }
        checkoutData.add("custom", custom);

        JsonObject productOptions = new JsonObject();
        String redirectUrl = request.getRedirectUrl() != null ? request.getRedirectUrl() : defaultRedirectUrl;
        if (redirectUrl != null && !redirectUrl.isBlank()) {
            productOptions.addProperty("redirect_url", redirectUrl);
            productOptions.addProperty("receipt_link_url", redirectUrl);
        }
        productOptions.addProperty("receipt_button_text", "Go to Dashboard");

        JsonObject attributes = new JsonObject();
        attributes.add("checkout_data", checkoutData);
        attributes.add("product_options", productOptions);
        attributes.addProperty("test_mode", testMode);

        JsonObject relationships = new JsonObject();
        relationships.add("store", relationship("stores", storeId));
        relationships.add("variant", relationship("variants", request.getVariantId()));

        JsonObject data = new JsonObject();
        data.addProperty("type", "checkouts");
        data.add("attributes", attributes);
        data.add("relationships", relationships);

        JsonObject body = new JsonObject();
        body.add("data", data);
        return gson.toJson(body);
    }

    // ===================== 訂閱 =====================

    @Override
    public SubscriptionInfo getSubscription(String subscriptionId) {
        Request httpRequest = newRequest("/subscriptions/" + subscriptionId).get().build();
        try {
            return toSubscriptionInfo(requireData(execute(httpRequest, "getSubscription"), "getSubscription"));
        } catch (LemonSqueezyApiException e) {
            if (e.getStatusCode() == 404) {
                throw new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND,
                        "Subscription not found: " + subscriptionId, e);
            }
            throw e;
        }
    }

    /**
     * Lemon Squeezy 只支援期滿取消（DELETE 後狀態為 cancelled，ends_at 為當期結束）
     */
    @Override
    public CancelSubscriptionResponse cancelSubscription(CancelSubscriptionRequest request) {
        if (!request.isCancelAtPeriodEnd()) {
            log.info("Lemon Squeezy 不支援立即取消，改為期滿取消: subscriptionId={}",
                    request.getSubscriptionId());
        }
        Request httpRequest = newRequest("/subscriptions/" + request.getSubscriptionId())
                .delete()
                .build();

        JsonObject data = requireData(execute(httpRequest, "cancelSubscription"), "cancelSubscription");
        JsonObject attributes = data.getAsJsonObject("attributes");

        log.info("Lemon Squeezy 訂閱已取消: subscriptionId={}, reason={}",
                request.getSubscriptionId(), request.getReason());

        return CancelSubscriptionResponse.builder()
                .subscriptionId(request.getSubscriptionId())
                .status(normalizeStatus(string(attributes, "status")))
                .cancelledAt(DateTimeUtil.now())
                .endsAt(DateTimeUtil.parseIso(string(attributes, "ends_at")))
                .build();
    }

    /**
     * Customer Portal 連線由 customer 物件的 urls.customer_portal 提供（簽名網址，24 小時有效）
     */
    @Override
    public CustomerPortalResponse createCustomerPortal(String customerId, String returnUrl) {
        Request httpRequest = newRequest("/customers/" + customerId).get().build();
        JsonObject data = requireData(execute(httpRequest, "createCustomerPortal"), "createCustomerPortal");

        JsonObject attributes = data.getAsJsonObject("attributes");
        JsonObject urls = attributes != null ? attributes.getAsJsonObject("urls") : null;
        String portalUrl = string(urls, "customer_portal");
        if (portalUrl == null) {
            throw new LemonSqueezyApiException(200, "customer has no portal url: " + customerId);
        }
        if (returnUrl != null) {
            log.debug("Lemon Squeezy portal 不支援 returnUrl，忽略: {}", returnUrl);
        }

        return CustomerPortalResponse.builder()
                .portalUrl(portalUrl)
                .expiresAt(DateTimeUtil.now().plusHours(PORTAL_TTL_HOURS))
                .build();
    }

    @Override
    public List<SubscriptionInfo> getCustomerSubscriptions(String customerId) {
        log.warn("Lemon Squeezy API 不支援依 customer 查詢訂閱，回傳空列表: customerId={}", customerId);
        return List.of();
    }

    @Override
    public SubscriptionStatus normalizeStatus(String providerStatus) {
        if (providerStatus == null) {
            return SubscriptionStatus.ACTIVE;
        }
        SubscriptionStatus status = STATUS_MAP.get(providerStatus.trim().toLowerCase(Locale.ROOT));
        if (status == null) {
            log.warn("未知的 Lemon Squeezy 訂閱狀態，視為 ACTIVE: {}", providerStatus);
            return SubscriptionStatus.ACTIVE;
        }
        return status;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public boolean testConnection() {
        Request httpRequest = newRequest("/users/me").get().build();
        try {
            execute(httpRequest, "testConnection");
            return true;
        } catch (RuntimeException e) {
            log.warn("Lemon Squeezy 連線測試失敗: {}", e.getMessage());
            return false;
        }
    }

    // ===================== 簽名 =====================

    /**
     * X-Signature = hex(HMAC-SHA256(webhookSecret, rawBody))
     */
    @Override
    public boolean verifyWebhookSignature(String signature, String rawBody) {
        return HmacSignatureUtil.verify(rawBody, webhookSecret, signature);
    }

    // ===================== 工具方法 =====================

    private SubscriptionInfo toSubscriptionInfo(JsonObject data) {
        JsonObject a = data.getAsJsonObject("attributes");
        LocalDateTime renewsAt = DateTimeUtil.parseIso(string(a, "renews_at"));
        LocalDateTime endsAt = DateTimeUtil.parseIso(string(a, "ends_at"));
        String currency = string(a, "currency");

        return SubscriptionInfo.builder()
                .id(string(data, "id"))
                .status(normalizeStatus(string(a, "status")))
                .planId(string(a, "variant_id"))
                .customerId(string(a, "customer_id"))
                .amount(subscriptionAmount(a))
                .currency(currency != null ? currency.toUpperCase(Locale.ROOT) : AppConstants.DEFAULT_CURRENCY)
                .currentPeriodStart(DateTimeUtil.parseIso(string(a, "created_at")))
                .currentPeriodEnd(renewsAt != null ? renewsAt : endsAt)
                .cancelAtPeriodEnd(a != null && a.has("cancelled") && !a.get("cancelled").isJsonNull()
                        && a.get("cancelled").getAsBoolean())
                .trialEnd(DateTimeUtil.parseIso(string(a, "trial_ends_at")))
                .build();
    }

    /**
     * 金額以最小單位（cents）回傳：first_subscription_item.price，沒有時用 unit_price
     */
    private BigDecimal subscriptionAmount(JsonObject attributes) {
        String cents = null;
        if (attributes != null && attributes.has("first_subscription_item")
                && attributes.get("first_subscription_item").isJsonObject()) {
            cents = string(attributes.getAsJsonObject("first_subscription_item"), "price");
        }
        if (cents == null) {
            cents = string(attributes, "unit_price");
        }
        if (cents == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        try {
            return new BigDecimal(cents).movePointLeft(2).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            log.warn("無法解析訂閱金額: {}", cents);
            return BigDecimal.ZERO.setScale(2);
        }
    }

    private Request.Builder newRequest(String path) {
        return new Request.Builder()
                .url(baseUrl + path)
                .header("Accept", "application/vnd.api+json")
                .header("Content-Type", "application/vnd.api+json")
                .header("Authorization", "Bearer " + apiKey);
    }

    private JsonObject execute(Request request, String action) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.warn("Lemon Squeezy API 回應異常: action={}, HTTP {} - {}", action, response.code(), body);
                throw new LemonSqueezyApiException(response.code(),
                        action + " failed: HTTP " + response.code());
            }

            JsonObject json = body.isBlank() ? null : gson.fromJson(body, JsonObject.class);
            if (json == null) {
                throw new LemonSqueezyApiException(response.code(), action + " returned empty body");
            }
            return json;
        } catch (IOException e) {
            log.warn("Lemon Squeezy API 呼叫失敗: action={}, error={}", action, e.getMessage());
            throw new LemonSqueezyApiException(0, action + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonObject requireData(JsonObject json, String action) {
        JsonElement data = json.get("data");
        if (data == null || !data.isJsonObject()) {
            throw new LemonSqueezyApiException(200, action + " response has no data object");
        }
        return data.getAsJsonObject();
    }

    private static JsonObject relationship(String type, String id) {
        JsonObject data = new JsonObject();
        data.addProperty("type", type);
        data.addProperty("id", id);
        JsonObject wrapper = new JsonObject();
        wrapper.add("data", data);
        return wrapper;
    }

    private static String string(JsonObject obj, String key) {
        if (obj == null || !obj.has(key) || obj.get(key).isJsonNull()) {
            return null;
        }
        JsonElement element = obj.get(key);
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    private static String requireConfigured(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Lemon Squeezy 設定缺少 " + property);
        }
        return value;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

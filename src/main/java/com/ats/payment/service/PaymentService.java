package com.ats.payment.service;

import com.ats.payment.config.PaymentConfig;
import com.ats.payment.dto.*;
import com.ats.payment.gateway.PaymentGateway;
import com.ats.payment.gateway.WebhookSignatureVerifier;
import com.ats.payment.model.SubscriptionStatus;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.InternalServerErrorException;
import com.ats.shared.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 金流門面
 *
 * 業務程式碼唯一的金流入口。持有啟動時綁定的 {@link PaymentGateway}，
 * 每個方法：記錄意圖 → 委派 → 記錄結果；供應商例外一律轉成 ApiException，
 * 呼叫端看不到任何供應商專屬的例外型別或錯誤訊息格式。
 */
@Slf4j
@Service
public class PaymentService {

    private final PaymentGateway gateway;
    private final PaymentConfig paymentConfig;

    public PaymentService(PaymentGateway gateway, PaymentConfig paymentConfig) {
        this.gateway = gateway;
        this.paymentConfig = paymentConfig;
    }

    public CheckoutResponse createCheckout(CheckoutRequest request) {
        log.info("建立結帳頁: provider={}, variantId={}", gateway.getProviderName(), request.getVariantId());
        try {
            CheckoutResponse response = gateway.createCheckout(request);
            log.info("結帳頁已建立: checkoutId={}", response.getCheckoutId());
            return response;
        } catch (BadRequestException e) {
            throw e;
        } catch (Exception e) {
            log.error("建立結帳頁失敗: provider={}, error={}", gateway.getProviderName(), e.getMessage(), e);
            throw new InternalServerErrorException(ErrorCode.CHECKOUT_FAILED, "Failed to create checkout", e);
        }
    }

    public SubscriptionInfo getSubscription(String subscriptionId) {
        log.info("查詢供應商訂閱: subscriptionId={}", subscriptionId);
        try {
            SubscriptionInfo info = gateway.getSubscription(subscriptionId);
            log.info("供應商訂閱狀態: subscriptionId={}, status={}", subscriptionId, info.getStatus());
            return info;
        } catch (Exception e) {
            log.warn("查詢供應商訂閱失敗: subscriptionId={}, error={}", subscriptionId, e.getMessage());
            throw new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND,
                    "Subscription not found: " + subscriptionId, e);
        }
    }

    public CancelSubscriptionResponse cancelSubscription(CancelSubscriptionRequest request) {
        log.info("取消供應商訂閱: subscriptionId={}, atPeriodEnd={}",
                request.getSubscriptionId(), request.isCancelAtPeriodEnd());
        try {
            CancelSubscriptionResponse response = gateway.cancelSubscription(request);
            log.info("供應商訂閱已取消: subscriptionId={}, endsAt={}",
                    response.getSubscriptionId(), response.getEndsAt());
            return response;
        } catch (Exception e) {
            log.error("取消供應商訂閱失敗: subscriptionId={}, error={}",
                    request.getSubscriptionId(), e.getMessage(), e);
            throw new InternalServerErrorException(ErrorCode.CANCELLATION_FAILED,
                    "Failed to cancel subscription", e);
        }
    }

    public CustomerPortalResponse createCustomerPortal(String customerId, String returnUrl) {
        log.info("建立 customer portal: customerId={}", customerId);
        try {
            CustomerPortalResponse response = gateway.createCustomerPortal(customerId, returnUrl);
            log.info("customer portal 已建立: customerId={}", customerId);
            return response;
        } catch (Exception e) {
            log.error("建立 customer portal 失敗: customerId={}, error={}", customerId, e.getMessage(), e);
            throw new InternalServerErrorException(ErrorCode.PORTAL_FAILED,
                    "Failed to create customer portal", e);
        }
    }

    public List<SubscriptionInfo> getCustomerSubscriptions(String customerId) {
        log.info("查詢客戶訂閱列表: customerId={}", customerId);
        try {
            List<SubscriptionInfo> subscriptions = gateway.getCustomerSubscriptions(customerId);
            log.info("客戶訂閱數: customerId={}, count={}", customerId, subscriptions.size());
            return subscriptions;
        } catch (Exception e) {
            log.warn("查詢客戶訂閱失敗: customerId={}, error={}", customerId, e.getMessage());
            throw new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND,
                    "Subscriptions not found for customer: " + customerId, e);
        }
    }

    /**
     * 驗證 webhook 簽名
     *
     * 供應商沒有驗證能力時依 payment.webhook.allow-unverified 決定（預設放行），兩種情況都會記 warning。
     * 驗證過程拋例外一律視為驗證失敗。
     */
    public boolean verifyWebhookSignature(String signature, String rawBody) {
        if (!(gateway instanceof WebhookSignatureVerifier)) {
            boolean allow = paymentConfig.getWebhook().isAllowUnverified();
            log.warn("供應商 {} 不支援 webhook 簽名驗證，依設定{}此 webhook",
                    gateway.getProviderName(), allow ? "放行" : "拒絕");
            return allow;
        }
        try {
            boolean valid = ((WebhookSignatureVerifier) gateway).verifyWebhookSignature(signature, rawBody);
            if (!valid) {
                log.warn("Webhook 簽名不符: provider={}, signaturePresent={}",
                        gateway.getProviderName(), signature != null && !signature.isBlank());
            }
            return valid;
        } catch (Exception e) {
            log.error("Webhook 簽名驗證發生錯誤: {}", e.getMessage(), e);
            return false;
        }
    }

    public SubscriptionStatus normalizeSubscriptionStatus(String providerStatus) {
        return gateway.normalizeStatus(providerStatus);
    }

    public String getProviderName() {
        return gateway.getProviderName();
    }

    public ProviderHealthResponse healthCheck() {
        String provider = gateway.getProviderName();
        try {
            boolean reachable = gateway.testConnection();
            return ProviderHealthResponse.builder()
                    .provider(provider)
                    .status(reachable ? "healthy" : "unhealthy")
                    .message(reachable ? "Payment provider is reachable" : "Payment provider connection test failed")
                    .build();
        } catch (Exception e) {
            log.error("金流供應商 health check 失敗: {}", e.getMessage(), e);
            return ProviderHealthResponse.builder()
                    .provider(provider)
                    .status("unhealthy")
                    .message("Payment provider health check failed")
                    .build();
        }
    }
}

package com.ats.payment.gateway;

import com.ats.payment.dto.*;
import com.ats.payment.model.SubscriptionStatus;

import java.util.List;

/**
 * 金流供應商抽象
 *
 * 每個供應商一個實作，啟動時由 {@link PaymentGatewayFactory} 依設定挑出唯一一個，
 * 業務程式碼只透過 PaymentService 使用，不直接依賴具體實作。
 *
 * 簽名驗證是可選能力，實作另外實作 {@link WebhookSignatureVerifier}。
 */
public interface PaymentGateway {

    /**
     * 建立結帳頁
     *
     * @throws com.ats.shared.exception.BadRequestException variantId 為空
     */
    CheckoutResponse createCheckout(CheckoutRequest request);

    /**
     * @throws com.ats.shared.exception.NotFoundException 供應商查無此訂閱
     */
    SubscriptionInfo getSubscription(String subscriptionId);

    CancelSubscriptionResponse cancelSubscription(CancelSubscriptionRequest request);

    CustomerPortalResponse createCustomerPortal(String customerId, String returnUrl);

    /**
     * 供應商不支援時回傳空 list
     */
    List<SubscriptionInfo> getCustomerSubscriptions(String customerId);

    /**
     * 供應商狀態字串 → 內部狀態
     */
    SubscriptionStatus normalizeStatus(String providerStatus);

    String getProviderName();

    /**
     * 連線測試（health check 用），預設視為正常
     */
    default boolean testConnection() {
        return true;
    }
}

package com.ats.subscription.service;

import com.ats.payment.config.PaymentConfig;
import com.ats.payment.dto.CancelSubscriptionRequest;
import com.ats.payment.dto.CancelSubscriptionResponse;
import com.ats.payment.dto.CheckoutRequest;
import com.ats.payment.dto.CheckoutResponse;
import com.ats.payment.dto.CustomerPortalResponse;
import com.ats.payment.dto.SubscriptionInfo;
import com.ats.payment.model.SubscriptionStatus;
import com.ats.payment.service.PaymentService;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.NotFoundException;
import com.ats.shared.util.DateTimeUtil;
import com.ats.subscription.dto.CreateCheckoutRequest;
import com.ats.subscription.dto.SubscriptionResponse;
import com.ats.subscription.entity.Subscription;
import com.ats.subscription.entity.SubscriptionPlan;
import com.ats.subscription.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 訂閱服務
 *
 * 負責：
 * 1. 建立結帳頁（已有有效訂閱時拒絕，不呼叫供應商）
 * 2. 查詢用戶訂閱
 * 3. 取消訂閱、開啟客戶管理頁
 *
 * 訂閱的建立與狀態轉移由 webhook 對帳負責，見 {@link SubscriptionReconciliationService}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanService planService;
    private final PaymentService paymentService;
    private final PaymentConfig paymentConfig;

    // ===================== 結帳 =====================

    /**
     * 建立結帳頁
     *
     * custom data 會在 webhook 原樣帶回，用來連結用戶與方案。
     *
     * @throws NotFoundException   方案不存在
     * @throws BadRequestException 方案停用、未設定 variant，或用戶已有有效訂閱
     */
    public CheckoutResponse createCheckout(String userId, CreateCheckoutRequest request) {
        SubscriptionPlan plan = planService.getPlan(request.getPlanId());
        if (!plan.isActive()) {
            throw new BadRequestException(ErrorCode.PLAN_INACTIVE, "Plan is not active: " + plan.getId());
        }
        if (plan.getExternalVariantId() == null || plan.getExternalVariantId().isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_VARIANT,
                    "Plan has no provider variant: " + plan.getId());
        }
        if (subscriptionRepository.existsByUserIdAndActiveTrueAndCancelledFalse(userId)) {
            log.info("用戶已有有效訂閱，拒絕結帳: userId={}, planId={}", userId, plan.getId());
            throw new BadRequestException(ErrorCode.ACTIVE_SUBSCRIPTION_EXISTS, "active subscription exists");
        }

        String email = request.getMetadata() != null ? request.getMetadata().getEmail() : null;

        Map<String, String> customData = new LinkedHashMap<>();
        customData.put("user_id", userId);
        customData.put("plan_id", String.valueOf(plan.getId()));
        if (email != null && !email.isBlank()) {
            customData.put("email", email);
        }

        CheckoutResponse response = paymentService.createCheckout(CheckoutRequest.builder()
                .variantId(plan.getExternalVariantId())
                .customerEmail(email)
                .redirectUrl(paymentConfig.getSuccessUrl())
                .customData(customData)
                .build());

        log.info("結帳頁已建立: userId={}, planId={}, checkoutId={}", userId, plan.getId(), response.getCheckoutId());
        return response;
    }

    // ===================== 查詢方法 =====================

    public Subscription getSubscription(Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND,
                        "Subscription not found: " + subscriptionId));
    }

    public SubscriptionResponse toResponse(Subscription subscription) {
        String planName = planService.findQuietly(subscription.getSubscriptionPlanId())
                .map(SubscriptionPlan::getPlanName)
                .orElse(null);
        return SubscriptionResponse.from(subscription, planName);
    }

    public List<SubscriptionResponse> getUserSubscriptions(String userId) {
        return subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * 用戶目前的有效訂閱（active 且未取消，取最新一筆）
     *
     * @throws NotFoundException 沒有有效訂閱
     */
    public SubscriptionResponse getActiveSubscription(String userId) {
        return subscriptionRepository.findActiveByUserId(userId).stream()
                .findFirst()
                .map(this::toResponse)
                .orElseThrow(() -> new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND,
                        "No active subscription for user: " + userId));
    }

    /**
     * 直接向供應商查詢訂閱（對帳排查用）
     */
    public SubscriptionInfo getProviderSubscription(String externalSubscriptionId) {
        return paymentService.getSubscription(externalSubscriptionId);
    }

    public boolean isUserSubscribed(String userId) {
        return subscriptionRepository.existsByUserIdAndActiveTrueAndCancelledFalse(userId);
    }

    // ===================== 管理操作 =====================

    /**
     * 向供應商取消訂閱，成功後同步本地狀態
     *
     * @param requestedBy 發起取消的用戶（本人或管理員），僅記錄用
     */
    public SubscriptionResponse cancelSubscription(String requestedBy, Long subscriptionId,
                                                   boolean cancelAtPeriodEnd, String reason) {
        Subscription subscription = getSubscription(subscriptionId);
        if (subscription.isCancelled()) {
            log.info("訂閱已取消，略過: subscriptionId={}", subscriptionId);
            return toResponse(subscription);
        }

        CancelSubscriptionResponse result = paymentService.cancelSubscription(CancelSubscriptionRequest.builder()
                .subscriptionId(subscription.getExternalSubscriptionId())
                .cancelAtPeriodEnd(cancelAtPeriodEnd)
                .reason(reason)
                .build());

        subscription.setStatus(SubscriptionStatus.CANCELLED);
        subscription.setActive(false);
        subscription.setCancelled(true);
        subscription.setCancelledAt(result.getCancelledAt() != null ? result.getCancelledAt() : DateTimeUtil.now());
        if (result.getEndsAt() != null) {
            subscription.setEndsAt(result.getEndsAt());
        }
        Subscription saved = subscriptionRepository.save(subscription);

        log.info("訂閱已取消: subscriptionId={}, userId={}, requestedBy={}, endsAt={}, reason={}",
                subscriptionId, saved.getUserId(), requestedBy, saved.getEndsAt(), reason);
        return toResponse(saved);
    }

    /**
     * 開啟供應商的客戶管理頁
     *
     * 優先使用有效訂閱的客戶 ID，其次是最近一筆有客戶 ID 的訂閱。
     *
     * @throws BadRequestException 用戶沒有任何連結到供應商客戶的訂閱
     */
    public CustomerPortalResponse createCustomerPortal(String userId, String returnUrl) {
        String customerId = subscriptionRepository.findActiveByUserId(userId).stream()
                .map(Subscription::getExternalCustomerId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst()
                .or(() -> subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                        .map(Subscription::getExternalCustomerId)
                        .filter(id -> id != null && !id.isBlank())
                        .findFirst())
                .orElseThrow(() -> new BadRequestException(ErrorCode.CUSTOMER_NOT_LINKED,
                        "No provider customer linked to user: " + userId));

        return paymentService.createCustomerPortal(customerId, returnUrl);
    }
}

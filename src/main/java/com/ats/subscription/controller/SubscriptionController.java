package com.ats.subscription.controller;

import com.ats.payment.dto.CheckoutResponse;
import com.ats.payment.dto.CustomerPortalResponse;
import com.ats.payment.dto.ProviderHealthResponse;
import com.ats.payment.dto.SubscriptionInfo;
import com.ats.payment.service.PaymentService;
import com.ats.shared.util.SecurityUtil;
import com.ats.subscription.dto.*;
import com.ats.subscription.entity.Subscription;
import com.ats.subscription.entity.SubscriptionPlan;
import com.ats.subscription.service.PaymentConfirmationService;
import com.ats.subscription.service.PaymentLedgerService;
import com.ats.subscription.service.SubscriptionPlanService;
import com.ats.subscription.service.SubscriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 訂閱與金流 API
 *
 * 路徑：/subscriptions
 *
 * 公開端點：
 * - POST /payment-confirmation        → 金流 webhook（header x-signature）
 * - GET  /plans, /plans/{id}, /plans/variant/{variantId} → 方案目錄
 *
 * JWT 端點：
 * - POST   /checkout                  → 建立結帳頁
 * - POST   /customer-portal           → 開啟客戶管理頁
 * - GET    /subscriptions/{id}        → 單筆訂閱（本人或管理員）
 * - DELETE /subscriptions/{id}/cancel → 取消訂閱（本人或管理員）
 * - GET    /user/{userId}/...         → 用戶的訂閱、有效訂閱、付款紀錄（本人或管理員）
 * - GET    /subscriptions/provider/{externalId}, /payments/stats, /provider/health → 管理員
 */
@Slf4j
@RestController
@RequestMapping("/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final SubscriptionPlanService planService;
    private final PaymentConfirmationService paymentConfirmationService;
    private final PaymentLedgerService ledgerService;
    private final PaymentService paymentService;

    // ===================== 結帳 / webhook =====================

    /**
     * 建立結帳頁
     * POST /subscriptions/checkout
     * Body: {@link CreateCheckoutRequest}
     */
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> createCheckout(@Valid @RequestBody CreateCheckoutRequest request) {
        String userId = SecurityUtil.getCurrentUserId();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subscriptionService.createCheckout(userId, request));
    }

    /**
     * 金流 webhook（公開端點，供應商伺服器直接呼叫）
     * POST /subscriptions/payment-confirmation
     *
     * body 以原始字串接收，簽章以原始 bytes 計算。
     * 錯誤由 GlobalExceptionHandler 轉為 400。
     */
    @PostMapping("/payment-confirmation")
    public ResponseEntity<PaymentConfirmationResponse> paymentConfirmation(
            @RequestBody String payload,
            @RequestHeader(value = "x-signature", required = false) String signature) {
        return ResponseEntity.ok(paymentConfirmationService.processWebhook(payload, signature));
    }

    // ===================== 方案目錄 =====================

    @GetMapping("/plans")
    public ResponseEntity<List<PlanResponse>> getPlans() {
        return ResponseEntity.ok(planService.getActivePlans());
    }

    @GetMapping("/plans/{id}")
    public ResponseEntity<PlanResponse> getPlan(@PathVariable("id") Long id) {
        return ResponseEntity.ok(PlanResponse.from(planService.getPlan(id)));
    }

    @GetMapping("/plans/variant/{variantId}")
    public ResponseEntity<PlanResponse> getPlanByVariant(@PathVariable("variantId") String variantId) {
        SubscriptionPlan plan = planService.getPlanByVariantId(variantId);
        return ResponseEntity.ok(PlanResponse.from(plan));
    }

    // ===================== 訂閱 =====================

    @GetMapping("/subscriptions/{id}")
    public ResponseEntity<SubscriptionResponse> getSubscription(@PathVariable("id") Long id) {
        Subscription subscription = subscriptionService.getSubscription(id);
        SecurityUtil.requireSelfOrAdmin(subscription.getUserId());
        return ResponseEntity.ok(subscriptionService.toResponse(subscription));
    }

    @GetMapping("/subscriptions/provider/{externalId}")
    public ResponseEntity<SubscriptionInfo> getProviderSubscription(@PathVariable("externalId") String externalId) {
        SecurityUtil.requireAdmin();
        return ResponseEntity.ok(subscriptionService.getProviderSubscription(externalId));
    }

    /**
     * 取消訂閱
     * DELETE /subscriptions/subscriptions/{id}/cancel
     * Body（可省略）: {@link CancelSubscriptionBody}
     */
    @DeleteMapping("/subscriptions/{id}/cancel")
    public ResponseEntity<SubscriptionResponse> cancelSubscription(
            @PathVariable("id") Long id,
            @RequestBody(required = false) CancelSubscriptionBody body) {
        Subscription subscription = subscriptionService.getSubscription(id);
        SecurityUtil.requireSelfOrAdmin(subscription.getUserId());

        CancelSubscriptionBody options = body != null ? body : new CancelSubscriptionBody();
        return ResponseEntity.ok(subscriptionService.cancelSubscription(
                SecurityUtil.getCurrentUserId(), id, options.isCancelAtPeriodEnd(), options.getReason()));
    }

    @PostMapping("/customer-portal")
    public ResponseEntity<CustomerPortalResponse> createCustomerPortal(
            @RequestBody(required = false) CustomerPortalRequest request) {
        String userId = SecurityUtil.getCurrentUserId();
        String returnUrl = request != null ? request.getReturnUrl() : null;
        return ResponseEntity.ok(subscriptionService.createCustomerPortal(userId, returnUrl));
    }

    // ===================== 用戶 =====================

    @GetMapping("/user/{userId}/subscriptions")
    public ResponseEntity<List<SubscriptionResponse>> getUserSubscriptions(@PathVariable("userId") String userId) {
        SecurityUtil.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(subscriptionService.getUserSubscriptions(userId));
    }

    @GetMapping("/user/{userId}/active-subscription")
    public ResponseEntity<SubscriptionResponse> getActiveSubscription(@PathVariable("userId") String userId) {
        SecurityUtil.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(subscriptionService.getActiveSubscription(userId));
    }

    @GetMapping("/user/{userId}/payments")
    public ResponseEntity<List<LedgerEntryResponse>> getUserPayments(@PathVariable("userId") String userId) {
        SecurityUtil.requireSelfOrAdmin(userId);
        List<LedgerEntryResponse> payments = ledgerService.findByUserId(userId).stream()
                .map(LedgerEntryResponse::from)
                .toList();
        return ResponseEntity.ok(payments);
    }

    // ===================== 管理員 =====================

    @GetMapping("/payments/stats")
    public ResponseEntity<PaymentStatsResponse> getPaymentStats() {
        SecurityUtil.requireAdmin();
        return ResponseEntity.ok(ledgerService.getPaymentStats());
    }

    @GetMapping("/provider/health")
    public ResponseEntity<ProviderHealthResponse> getProviderHealth() {
        SecurityUtil.requireAdmin();
        return ResponseEntity.ok(paymentService.healthCheck());
    }
}

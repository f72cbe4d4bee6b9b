package com.ats.subscription.service;

import com.ats.notification.service.EmailNotificationService;
import com.ats.payment.model.SubscriptionStatus;
import com.ats.payment.service.PaymentService;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.util.DateTimeUtil;
import com.ats.subscription.entity.PaymentLedgerEntry;
import com.ats.subscription.entity.Subscription;
import com.ats.subscription.entity.SubscriptionPlan;
import com.ats.subscription.model.WebhookEvent;
import com.ats.subscription.repository.SubscriptionRepository;
import com.ats.user.entity.User;
import com.ats.user.service.UserService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 訂閱對帳（webhook 事件 → 訂閱狀態轉移）
 *
 * 事件路由：
 * - subscription_created / payment_success / resumed / unpaused → 建立（不存在時）或重新啟用
 * - subscription_cancelled → CANCELLED，active=false，cancelled=true，cancelledAt=now
 * - subscription_expired   → EXPIRED，active=false
 * - subscription_paused    → PAUSED，active=false
 * - subscription_payment_failed → PAST_DUE（寬限期內仍可使用）
 * - subscription_updated / plan_changed → 依供應商狀態、期間、方案同步
 * - 其他事件 → 記 log 後略過
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionReconciliationService {

    /** 供應商沒給期間時，預設一期 30 天 */
    static final long DEFAULT_PERIOD_DAYS = 30;

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanService planService;
    private final PaymentService paymentService;
    private final UserService userService;
    private final EmailNotificationService emailNotificationService;

    /**
     * 依事件轉移訂閱狀態
     *
     * @param eventName meta.event_name
     * @param payload   已解析的 webhook payload
     * @param entry     本次通知的帳本（提供已解析的用戶、方案、金額）
     * @throws BadRequestException 需要建立訂閱但無法對應用戶
     */
    public ReconciliationResult reconcile(String eventName, JsonNode payload, PaymentLedgerEntry entry) {
        Optional<WebhookEvent> event = WebhookEvent.fromEventName(eventName);
        if (event.isEmpty()) {
            log.info("未知的事件類型，略過: {}", eventName);
            return ReconciliationResult.ignored();
        }

        String externalId = resolveExternalSubscriptionId(payload);
        if (externalId == null) {
            log.warn("事件無法取得訂閱 ID，略過: event={}", eventName);
            return ReconciliationResult.ignored();
        }

        JsonNode attributes = payload.at("/data/attributes");
        WebhookEvent webhookEvent = event.get();

        if (webhookEvent.isActivation()) {
            return activate(externalId, attributes, entry);
        }

        return switch (webhookEvent) {
            case SUBSCRIPTION_CANCELLED -> transition(externalId, SubscriptionStatus.CANCELLED, attributes, entry);
            case SUBSCRIPTION_EXPIRED -> transition(externalId, SubscriptionStatus.EXPIRED, attributes, entry);
            case SUBSCRIPTION_PAUSED -> transition(externalId, SubscriptionStatus.PAUSED, attributes, entry);
            case SUBSCRIPTION_PAYMENT_FAILED -> transition(externalId, SubscriptionStatus.PAST_DUE, attributes, entry);
            case SUBSCRIPTION_UPDATED, SUBSCRIPTION_PLAN_CHANGED -> transition(externalId,
                    paymentService.normalizeSubscriptionStatus(text(attributes, "status")), attributes, entry);
            default -> {
                log.info("事件與訂閱狀態無關，略過: event={}, subscriptionId={}", eventName, externalId);
                yield ReconciliationResult.ignored();
            }
        };
    }

    // ===================== 啟用 =====================

    private ReconciliationResult activate(String externalId, JsonNode attributes, PaymentLedgerEntry entry) {
        Optional<Subscription> existing = subscriptionRepository.findByExternalSubscriptionId(externalId);
        if (existing.isPresent()) {
            return transition(existing.get(), SubscriptionStatus.ACTIVE, attributes, entry);
        }

        Subscription subscription = buildNewSubscription(externalId, attributes, entry);
        if (subscriptionRepository.existsByUserIdAndActiveTrueAndCancelledFalse(subscription.getUserId())) {
            log.warn("用戶已有有效訂閱，仍建立新訂閱: userId={}, subscriptionId={}",
                    subscription.getUserId(), externalId);
        }

        Subscription saved;
        try {
            saved = subscriptionRepository.saveAndFlush(subscription);
        } catch (DataIntegrityViolationException e) {
            log.info("訂閱已由並發請求建立，改為更新: subscriptionId={}", externalId);
            Subscription concurrent = subscriptionRepository.findByExternalSubscriptionId(externalId)
                    .orElseThrow(() -> e);
            return transition(concurrent, SubscriptionStatus.ACTIVE, attributes, entry);
        }

        log.info("新訂閱已建立: userId={}, planId={}, subscriptionId={}, endsAt={}",
                saved.getUserId(), saved.getSubscriptionPlanId(), externalId, saved.getEndsAt());
        notifyActivated(saved, entry);
        return ReconciliationResult.created(saved);
    }

    private Subscription buildNewSubscription(String externalId, JsonNode attributes, PaymentLedgerEntry entry) {
        if (entry.getUserId() == null) {
            throw new BadRequestException(ErrorCode.UNRESOLVED_SUBSCRIPTION_OWNER,
                    "Cannot link subscription " + externalId + " to a user");
        }

        Long planId = entry.getSubscriptionPlanId();
        if (planId == null) {
            planId = planService.findByVariantQuietly(text(attributes, "variant_id"))
                    .map(SubscriptionPlan::getId)
                    .orElse(null);
        }
        if (planId == null) {
            log.warn("新訂閱無法對應方案: subscriptionId={}", externalId);
        }

        LocalDateTime now = DateTimeUtil.now();
        LocalDateTime startsAt = DateTimeUtil.parseIso(text(attributes, "created_at"));
        LocalDateTime endsAt = periodEnd(attributes);

        return Subscription.builder()
                .externalSubscriptionId(externalId)
                .externalCustomerId(text(attributes, "customer_id"))
                .userId(entry.getUserId())
                .subscriptionPlanId(planId)
                .status(SubscriptionStatus.ACTIVE)
                .active(true)
                .cancelled(false)
                .startsAt(startsAt != null ? startsAt : now)
                .endsAt(endsAt != null ? endsAt : now.plusDays(DEFAULT_PERIOD_DAYS))
                .amount(subscriptionAmount(entry, planId))
                .currency(entry.getCurrency())
                .build();
    }

    // ===================== 狀態轉移 =====================

    private ReconciliationResult transition(String externalId, SubscriptionStatus target,
                                            JsonNode attributes, PaymentLedgerEntry entry) {
        Optional<Subscription> existing = subscriptionRepository.findByExternalSubscriptionId(externalId);
        if (existing.isEmpty()) {
            log.warn("找不到對應訂閱，略過狀態轉移: subscriptionId={}, target={}", externalId, target);
            return ReconciliationResult.ignored();
        }
        return transition(existing.get(), target, attributes, entry);
    }

    private ReconciliationResult transition(Subscription subscription, SubscriptionStatus target,
                                            JsonNode attributes, PaymentLedgerEntry entry) {
        boolean wasUsable = subscription.isCurrentlyActive();
        boolean wasCancelled = subscription.isCancelled();
        SubscriptionStatus previous = subscription.getStatus();

        applyStatus(subscription, target);
        applyPeriod(subscription, target, attributes);

        if (subscription.getExternalCustomerId() == null) {
            subscription.setExternalCustomerId(text(attributes, "customer_id"));
        }
        planService.findByVariantQuietly(text(attributes, "variant_id"))
                .ifPresent(plan -> subscription.setSubscriptionPlanId(plan.getId()));

        Subscription saved = subscriptionRepository.save(subscription);
        log.info("訂閱狀態更新: subscriptionId={}, userId={}, {} → {}, active={}, cancelled={}",
                saved.getExternalSubscriptionId(), saved.getUserId(), previous, target,
                saved.isActive(), saved.isCancelled());

        if (!wasUsable && saved.isCurrentlyActive()) {
            notifyActivated(saved, entry);
        } else if (!wasCancelled && saved.isCancelled()) {
            notifyCancelled(saved, entry);
        }
        return ReconciliationResult.updated(saved);
    }

    private static void applyStatus(Subscription subscription, SubscriptionStatus target) {
        switch (target) {
            case ACTIVE -> {
                subscription.setActive(true);
                subscription.setCancelled(false);
                subscription.setCancelledAt(null);
            }
            case CANCELLED -> {
                subscription.setActive(false);
                subscription.setCancelled(true);
                if (subscription.getCancelledAt() == null) {
                    subscription.setCancelledAt(DateTimeUtil.now());
                }
            }
            case EXPIRED, PAUSED -> subscription.setActive(false);
            case PAST_DUE -> {
                // 寬限期：保留 active
            }
        }
        subscription.setStatus(target);
    }

    /**
     * 取消/到期以 ends_at 為準，其他狀態以下次續約日為準；payload 沒帶就不動
     */
    private static void applyPeriod(Subscription subscription, SubscriptionStatus target, JsonNode attributes) {
        LocalDateTime endsAt = (target == SubscriptionStatus.CANCELLED || target == SubscriptionStatus.EXPIRED)
                ? DateTimeUtil.parseIso(text(attributes, "ends_at"))
                : periodEnd(attributes);
        if (endsAt != null) {
            subscription.setEndsAt(endsAt);
        }
    }

    // ===================== 通知 =====================

    private void notifyActivated(Subscription subscription, PaymentLedgerEntry entry) {
        try {
            Optional<User> user = userService.findQuietly(subscription.getUserId());
            emailNotificationService.sendSubscriptionActivated(
                    recipient(user, entry),
                    user.map(User::getName).orElse(null),
                    planName(subscription),
                    subscription.getAmount(),
                    subscription.getCurrency(),
                    subscription.getEndsAt());
        } catch (Exception e) {
            log.warn("訂閱啟用通知失敗: subscriptionId={}, error={}",
                    subscription.getExternalSubscriptionId(), e.getMessage());
        }
    }

    private void notifyCancelled(Subscription subscription, PaymentLedgerEntry entry) {
        try {
            Optional<User> user = userService.findQuietly(subscription.getUserId());
            emailNotificationService.sendSubscriptionCancelled(
                    recipient(user, entry),
                    user.map(User::getName).orElse(null),
                    planName(subscription),
                    subscription.getEndsAt());
        } catch (Exception e) {
            log.warn("訂閱取消通知失敗: subscriptionId={}, error={}",
                    subscription.getExternalSubscriptionId(), e.getMessage());
        }
    }

    private static String recipient(Optional<User> user, PaymentLedgerEntry entry) {
        return user.map(User::getEmail).orElse(entry != null ? entry.getCustomerEmail() : null);
    }

    private String planName(Subscription subscription) {
        return planService.findQuietly(subscription.getSubscriptionPlanId())
                .map(SubscriptionPlan::getPlanName)
                .orElse(null);
    }

    // ===================== 工具方法 =====================

    /**
     * 發票類事件（subscription_payment_*）的 data.id 是發票，訂閱 ID 在 attributes.subscription_id
     */
    static String resolveExternalSubscriptionId(JsonNode payload) {
        String subscriptionId = text(payload.at("/data/attributes"), "subscription_id");
        if (subscriptionId != null) {
            return subscriptionId;
        }
        JsonNode id = payload.at("/data/id");
        return id.isValueNode() && !id.asText().isBlank() ? id.asText() : null;
    }

    private BigDecimal subscriptionAmount(PaymentLedgerEntry entry, Long planId) {
        if (entry.getAmount() != null && entry.getAmount().signum() > 0) {
            return entry.getAmount();
        }
        return planService.findQuietly(planId).map(SubscriptionPlan::getPrice).orElse(entry.getAmount());
    }

    private static LocalDateTime periodEnd(JsonNode attributes) {
        LocalDateTime renewsAt = DateTimeUtil.parseIso(text(attributes, "renews_at"));
        return renewsAt != null ? renewsAt : DateTimeUtil.parseIso(text(attributes, "ends_at"));
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}

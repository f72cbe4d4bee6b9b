package com.ats.subscription.dto;

import com.ats.subscription.entity.Subscription;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class SubscriptionResponse {

    private Long id;
    private String userId;
    private Long subscriptionPlanId;
    private String planName;
    private String status;
    private boolean active;
    private boolean cancelled;
    private LocalDateTime startsAt;
    private LocalDateTime endsAt;
    private LocalDateTime cancelledAt;
    private BigDecimal amount;
    private String currency;

    /** 供應商訂閱 ID */
    private String externalSubscriptionId;

    /** 供應商客戶 ID（開啟客戶管理頁用） */
    private String externalCustomerId;

    public static SubscriptionResponse from(Subscription subscription, String planName) {
        return SubscriptionResponse.builder()
                .id(subscription.getId())
                .userId(subscription.getUserId())
                .subscriptionPlanId(subscription.getSubscriptionPlanId())
                .planName(planName)
                .status(subscription.getStatus().name())
                .active(subscription.isActive())
                .cancelled(subscription.isCancelled())
                .startsAt(subscription.getStartsAt())
                .endsAt(subscription.getEndsAt())
                .cancelledAt(subscription.getCancelledAt())
                .amount(subscription.getAmount())
                .currency(subscription.getCurrency())
                .externalSubscriptionId(subscription.getExternalSubscriptionId())
                .externalCustomerId(subscription.getExternalCustomerId())
                .build();
    }
}

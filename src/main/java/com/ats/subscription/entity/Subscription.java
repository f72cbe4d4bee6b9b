package com.ats.subscription.entity;

import com.ats.payment.model.SubscriptionStatus;
import com.ats.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 用戶訂閱的目前狀態（由 webhook 對帳維護）
 *
 * 同一用戶最多一筆 active && !cancelled，由結帳前的檢查保證（非 DB 約束）。
 * 只會停用，不會刪除。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_sub_user_id", columnList = "userId"),
        @Index(name = "uk_sub_external_id", columnList = "externalSubscriptionId", unique = true)
})
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 供應商訂閱 ID */
    @Column(nullable = false, unique = true)
    private String externalSubscriptionId;

    /** 供應商客戶 ID（customer portal 用） */
    private String externalCustomerId;

    @Column(nullable = false)
    private String userId;

    private Long subscriptionPlanId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.ACTIVE;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean cancelled = false;

    private LocalDateTime startsAt;

    /** 當期結束（續約日或停止日） */
    private LocalDateTime endsAt;

    private LocalDateTime cancelledAt;

    @Column(precision = 12, scale = 2)
    private BigDecimal amount;

    @Builder.Default
    private String currency = AppConstants.DEFAULT_CURRENCY;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** 仍可使用服務 */
    public boolean isCurrentlyActive() {
        return active && !cancelled;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(AppConstants.ZONE_ID);
        updatedAt = LocalDateTime.now(AppConstants.ZONE_ID);
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(AppConstants.ZONE_ID);
    }
}

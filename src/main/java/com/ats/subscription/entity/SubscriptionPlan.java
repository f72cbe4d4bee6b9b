package com.ats.subscription.entity;

import com.ats.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "subscription_plans", indexes = {
        @Index(name = "idx_plans_active", columnList = "active"),
        @Index(name = "uk_plans_variant", columnList = "externalVariantId", unique = true)
})
public class SubscriptionPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String planName;

    private String description;

    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @Builder.Default
    private String currency = AppConstants.DEFAULT_CURRENCY;

    /** 供應商商品規格 ID（Lemon Squeezy variant） */
    @Column(unique = true)
    private String externalVariantId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private BillingCycle billingCycle = BillingCycle.MONTHLY;

    /** JSON：方案功能列表（履歷數、AI 分析次數等） */
    @Column(columnDefinition = "TEXT")
    private String features;

    @Builder.Default
    private boolean active = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum BillingCycle {
        MONTHLY, YEARLY, WEEKLY
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

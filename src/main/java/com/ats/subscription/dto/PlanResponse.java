package com.ats.subscription.dto;

import com.ats.subscription.entity.SubscriptionPlan;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 方案目錄：單個方案的回應 DTO
 */
@Data
@Builder
public class PlanResponse {

    private Long id;
    private String planName;
    private String description;
    private BigDecimal price;
    private String currency;
    private String billingCycle;

    /** JSON 字串，前端自行解析 */
    private String features;

    /** 供應商 variant ID */
    private String variantId;

    private boolean active;

    public static PlanResponse from(SubscriptionPlan plan) {
        return PlanResponse.builder()
                .id(plan.getId())
                .planName(plan.getPlanName())
                .description(plan.getDescription())
                .price(plan.getPrice())
                .currency(plan.getCurrency())
                .billingCycle(plan.getBillingCycle() != null ? plan.getBillingCycle().name() : null)
                .features(plan.getFeatures())
                .variantId(plan.getExternalVariantId())
                .active(plan.isActive())
                .build();
    }
}

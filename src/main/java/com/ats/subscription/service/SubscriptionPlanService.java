package com.ats.subscription.service;

import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.NotFoundException;
import com.ats.subscription.dto.PlanResponse;
import com.ats.subscription.entity.SubscriptionPlan;
import com.ats.subscription.repository.SubscriptionPlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 方案目錄（唯讀）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionPlanService {

    private final SubscriptionPlanRepository planRepository;

    public List<PlanResponse> getActivePlans() {
        return planRepository.findByActiveTrueOrderByPriceAsc().stream()
                .map(PlanResponse::from)
                .toList();
    }

    public SubscriptionPlan getPlan(Long planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PLAN_NOT_FOUND, "Plan not found: " + planId));
    }

    public SubscriptionPlan getPlanByVariantId(String variantId) {
        return planRepository.findByExternalVariantId(variantId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PLAN_NOT_FOUND,
                        "Plan not found for variant: " + variantId));
    }

    // ===================== webhook 連結用（不拋例外） =====================

    public Optional<SubscriptionPlan> findQuietly(Long planId) {
        if (planId == null) {
            return Optional.empty();
        }
        try {
            return planRepository.findById(planId);
        } catch (Exception e) {
            log.warn("查詢方案失敗: planId={}, error={}", planId, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<SubscriptionPlan> findByVariantQuietly(String variantId) {
        if (variantId == null || variantId.isBlank()) {
            return Optional.empty();
        }
        try {
            return planRepository.findByExternalVariantId(variantId);
        } catch (Exception e) {
            log.warn("依 variant 查詢方案失敗: variantId={}, error={}", variantId, e.getMessage());
            return Optional.empty();
        }
    }
}

package com.ats.payment.dto;

import com.ats.payment.model.SubscriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 供應商端的訂閱快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionInfo {

    private String id;
    private SubscriptionStatus status;

    /** 供應商的 variant ID */
    private String planId;

    private String customerId;
    private BigDecimal amount;
    private String currency;
    private LocalDateTime currentPeriodStart;
    private LocalDateTime currentPeriodEnd;
    private boolean cancelAtPeriodEnd;
    private LocalDateTime trialEnd;
}

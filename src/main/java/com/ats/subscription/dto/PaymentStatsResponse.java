package com.ats.subscription.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class PaymentStatsResponse {

    private long totalPayments;
    private long successfulPayments;
    private long failedPayments;

    /** 成功付款總額（不含測試模式） */
    private BigDecimal totalRevenue;

    /** 成功率（百分比，兩位小數） */
    private BigDecimal successRate;
}

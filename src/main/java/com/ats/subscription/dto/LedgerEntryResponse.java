package com.ats.subscription.dto;

import com.ats.subscription.entity.PaymentLedgerEntry;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 帳本摘要（不含 rawPayload）
 */
@Data
@Builder
public class LedgerEntryResponse {

    private Long id;
    private String externalPaymentId;
    private String eventName;
    private String status;
    private String paymentType;
    private BigDecimal amount;
    private String currency;
    private Long subscriptionPlanId;
    private boolean testMode;
    private LocalDateTime processedAt;
    private int retryCount;
    private String processingError;
    private LocalDateTime createdAt;

    public static LedgerEntryResponse from(PaymentLedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .id(entry.getId())
                .externalPaymentId(entry.getExternalPaymentId())
                .eventName(entry.getEventName())
                .status(entry.getStatus().name())
                .paymentType(entry.getPaymentType().name())
                .amount(entry.getAmount())
                .currency(entry.getCurrency())
                .subscriptionPlanId(entry.getSubscriptionPlanId())
                .testMode(entry.isTestMode())
                .processedAt(entry.getProcessedAt())
                .retryCount(entry.getRetryCount())
                .processingError(entry.getProcessingError())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}

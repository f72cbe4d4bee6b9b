package com.ats.subscription.dto;

import com.ats.subscription.entity.PaymentLedgerEntry;
import com.ats.subscription.entity.Subscription;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Webhook 處理結果摘要
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentConfirmationResponse {

    public static final String SUCCESS_MESSAGE = "Webhook processed successfully";

    private boolean success;
    private String message;
    private String eventName;

    /** 重送的通知（已處理過，本次未執行任何動作） */
    private boolean duplicate;

    private boolean subscriptionCreated;
    private boolean subscriptionUpdated;

    private PaymentHistory paymentHistory;

    /** 事件未影響訂閱時為 null */
    private SubscriptionSummary subscription;

    @Data
    @Builder
    public static class PaymentHistory {
        private Long id;
        private String status;
        private String paymentType;
        private BigDecimal amount;
        private String currency;

        public static PaymentHistory from(PaymentLedgerEntry entry) {
            return PaymentHistory.builder()
                    .id(entry.getId())
                    .status(entry.getStatus().name())
                    .paymentType(entry.getPaymentType() != null ? entry.getPaymentType().name() : null)
                    .amount(entry.getAmount())
                    .currency(entry.getCurrency())
                    .build();
        }
    }

    @Data
    @Builder
    public static class SubscriptionSummary {
        private Long subscriptionId;
        private String externalSubscriptionId;
        private String status;
        private boolean active;
        private String userId;
        private Long subscriptionPlanId;

        public static SubscriptionSummary from(Subscription subscription) {
            if (subscription == null) {
                return null;
            }
            return SubscriptionSummary.builder()
                    .subscriptionId(subscription.getId())
                    .externalSubscriptionId(subscription.getExternalSubscriptionId())
                    .status(subscription.getStatus().name())
                    .active(subscription.isActive())
                    .userId(subscription.getUserId())
                    .subscriptionPlanId(subscription.getSubscriptionPlanId())
                    .build();
        }
    }
}

package com.ats.subscription.entity;

import com.ats.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 金流通知帳本
 *
 * 每個供應商通知（以 externalPaymentId 區分）只有一列，重送時回傳既有那列。
 * 建立後只會被 markProcessed / markFailed / markRejected 修改，永不刪除；
 * 簽章驗證通過的重送若內容不同，以 replaceContent 覆寫為驗證後的內容。
 * rawPayload 保留原始 body 作為稽核依據。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "payment_ledger", indexes = {
        @Index(name = "uk_ledger_external_payment_id", columnList = "externalPaymentId", unique = true),
        @Index(name = "idx_ledger_user_id", columnList = "userId"),
        @Index(name = "idx_ledger_plan_id", columnList = "subscriptionPlanId"),
        @Index(name = "idx_ledger_status", columnList = "status")
})
public class PaymentLedgerEntry {

    public static final int MAX_RETRY_COUNT = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 供應商事件/交易 ID（data.id），去重主鍵 */
    @Column(nullable = false, unique = true)
    private String externalPaymentId;

    /** meta.event_name，例如 subscription_payment_success */
    private String eventName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentType paymentType;

    @Column(precision = 12, scale = 2)
    private BigDecimal amount;

    @Builder.Default
    private String currency = AppConstants.DEFAULT_CURRENCY;

    /** 由 custom data 解析出的用戶（可能為 null） */
    private String userId;

    /** 由 custom data 或 variant 解析出的方案（可能為 null） */
    private Long subscriptionPlanId;

    /** 原始通知 body，不做任何轉換 */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String rawPayload;

    private boolean testMode;

    private String customerEmail;

    private LocalDateTime processedAt;

    @Builder.Default
    private int retryCount = 0;

    private LocalDateTime lastRetryAt;

    @Column(columnDefinition = "TEXT")
    private String processingError;

    /** JSON：{"customData": {...}} */
    @Column(columnDefinition = "TEXT")
    private String metadata;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum Status {
        PENDING,     // 已記錄，尚未確認
        SUCCESS,     // 付款成功
        FAILED,      // 付款失敗或處理失敗
        CANCELLED,   // 已取消
        REFUNDED,    // 已退款
        EXPIRED      // 已到期
    }

    public enum PaymentType {
        SUBSCRIPTION,
        ONE_TIME,
        REFUND;

        /**
         * 事件名稱含 "subscription" → SUBSCRIPTION；含 "refund" → REFUND；其餘 ONE_TIME
         */
        public static PaymentType fromEventName(String eventName) {
            if (eventName == null) {
                return ONE_TIME;
            }
            if (eventName.contains("subscription")) {
                return SUBSCRIPTION;
            }
            if (eventName.contains("refund")) {
                return REFUND;
            }
            return ONE_TIME;
        }
    }

    /**
     * 處理成功：狀態回到通知本身的付款狀態，清掉先前的錯誤
     */
    public void markProcessed(Status payloadStatus, LocalDateTime now) {
        this.status = payloadStatus;
        this.processingError = null;
        this.processedAt = now;
    }

    /**
     * 處理失敗，消耗一次重試額度
     */
    public void markFailed(String reason, LocalDateTime now) {
        this.status = Status.FAILED;
        this.processingError = reason;
        this.retryCount++;
        this.lastRetryAt = now;
    }

    /**
     * 通知被拒收（簽章不符）：標記 FAILED 但不消耗重試額度
     */
    public void markRejected(String reason, LocalDateTime now) {
        this.status = Status.FAILED;
        this.processingError = reason;
        this.lastRetryAt = now;
    }

    /**
     * 以驗證後通知的內容覆寫解析欄位，處理狀態與重試紀錄不動
     */
    public void replaceContent(PaymentLedgerEntry verified) {
        this.eventName = verified.eventName;
        this.paymentType = verified.paymentType;
        this.amount = verified.amount;
        this.currency = verified.currency;
        this.userId = verified.userId;
        this.subscriptionPlanId = verified.subscriptionPlanId;
        this.rawPayload = verified.rawPayload;
        this.testMode = verified.testMode;
        this.customerEmail = verified.customerEmail;
        this.metadata = verified.metadata;
    }

    public boolean canRetry() {
        return retryCount < MAX_RETRY_COUNT && status == Status.FAILED;
    }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS;
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

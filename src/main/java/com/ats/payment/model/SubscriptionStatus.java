package com.ats.payment.model;

/**
 * 內部訂閱狀態（各供應商的狀態字串都正規化成這五種）
 */
public enum SubscriptionStatus {
    ACTIVE,      // 付費生效中（含試用）
    CANCELLED,   // 已取消
    EXPIRED,     // 已到期
    PAUSED,      // 暫停
    PAST_DUE     // 扣款失敗，寬限期中
}

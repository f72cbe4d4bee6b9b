package com.ats.shared.exception;

/**
 * 穩定錯誤代碼
 *
 * 回應 JSON 的 code 欄位，新增可以，改名不行（前端與監控都靠它分類）。
 */
public enum ErrorCode {

    // 400
    MALFORMED_PAYLOAD,
    INVALID_SIGNATURE,
    ACTIVE_SUBSCRIPTION_EXISTS,
    PLAN_INACTIVE,
    INVALID_VARIANT,
    UNRESOLVED_SUBSCRIPTION_OWNER,
    CUSTOMER_NOT_LINKED,
    UNKNOWN_PROVIDER,

    // 404
    PLAN_NOT_FOUND,
    SUBSCRIPTION_NOT_FOUND,
    LEDGER_ENTRY_NOT_FOUND,

    // 500
    PROVIDER_NOT_IMPLEMENTED,
    CHECKOUT_FAILED,
    CANCELLATION_FAILED,
    PORTAL_FAILED
}

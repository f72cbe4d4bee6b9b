package com.ats.payment.gateway.lemonsqueezy;

import lombok.Getter;

/**
 * Lemon Squeezy API 呼叫失敗（非 2xx、連線錯誤、回應格式不符）
 *
 * 只在 adapter 內部使用，PaymentService 會轉成 ApiException。
 */
@Getter
public class LemonSqueezyApiException extends RuntimeException {

    /** HTTP 狀態碼，連線層錯誤時為 0 */
    private final int statusCode;

    public LemonSqueezyApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public LemonSqueezyApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}

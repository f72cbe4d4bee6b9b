package com.ats.payment.gateway;

/**
 * 供應商 webhook 簽名驗證能力
 */
public interface WebhookSignatureVerifier {

    /**
     * @param signature 請求 header 帶來的簽名（可能為 null）
     * @param rawBody   未經任何轉換的原始 body
     * @return 簽名相符才回傳 true
     */
    boolean verifyWebhookSignature(String signature, String rawBody);
}

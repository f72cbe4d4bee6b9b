package com.ats.payment.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 金流設定
 *
 * 對應 application.yml:
 * payment:
 *   provider: lemonsqueezy
 *   success-url: https://app.example.com/billing/success
 *   webhook:
 *     allow-unverified: true
 */
@Getter
@ConfigurationProperties(prefix = "payment")
public class PaymentConfig {

    /** 啟用的供應商（只能一個） */
    private final String provider;

    /** 付款完成後導回的頁面 */
    private final String successUrl;

    private final Webhook webhook;

    public PaymentConfig(
            @DefaultValue("lemonsqueezy") String provider,
            String successUrl,
            @DefaultValue Webhook webhook) {
        this.provider = provider;
        this.successUrl = successUrl;
        this.webhook = webhook;
    }

    @Getter
    public static class Webhook {

        /**
         * 供應商沒有簽名驗證能力時，是否仍接受 webhook。
         * true = 接受並記 warning；false = 一律拒絕
         */
        private final boolean allowUnverified;

        public Webhook(@DefaultValue("true") boolean allowUnverified) {
            this.allowUnverified = allowUnverified;
        }
    }
}

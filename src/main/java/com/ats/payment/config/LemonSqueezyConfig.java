package com.ats.payment.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Lemon Squeezy 設定
 *
 * 對應 application.yml:
 * lemonsqueezy:
 *   api-key: ${LEMON_SQUEEZY_API_KEY}
 *   store-id: ${LEMON_SQUEEZY_STORE_ID}
 *   webhook-secret: ${LEMON_SQUEEZY_WEBHOOK_SECRET}
 */
@Getter
@ConfigurationProperties(prefix = "lemonsqueezy")
public class LemonSqueezyConfig {

    private final String apiKey;
    private final String storeId;
    private final String webhookSecret;
    private final String baseUrl;
    private final boolean testMode;

    public LemonSqueezyConfig(
            String apiKey,
            String storeId,
            String webhookSecret,
            @DefaultValue("https://api.lemonsqueezy.com/v1") String baseUrl,
            @DefaultValue("false") boolean testMode) {
        this.apiKey = apiKey;
        this.storeId = storeId;
        this.webhookSecret = webhookSecret;
        this.baseUrl = baseUrl;
        this.testMode = testMode;
    }
}

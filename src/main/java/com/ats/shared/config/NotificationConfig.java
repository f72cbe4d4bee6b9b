package com.ats.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 郵件通知設定
 *
 * 對應 application.yml:
 * notification:
 *   email:
 *     enabled: true
 *     url: https://mail-relay.internal/send
 *     sender: billing@example.com
 */
@Getter
@ConfigurationProperties(prefix = "notification.email")
public class NotificationConfig {

    private final String url;
    private final boolean enabled;
    private final String sender;

    public NotificationConfig(
            String url,
            @DefaultValue("false") boolean enabled,
            @DefaultValue("no-reply@resume-ats.local") String sender) {
        this.url = url;
        this.enabled = enabled;
        this.sender = sender;
    }
}

package com.ats.payment.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 設定檔 payment.provider 可接受的供應商
 */
@Getter
public enum PaymentProvider {

    LEMONSQUEEZY("lemonsqueezy", "LemonSqueezy"),
    STRIPE("stripe", "Stripe"),
    PADDLE("paddle", "Paddle"),
    PAYPAL("paypal", "PayPal");

    private final String configName;
    private final String displayName;

    PaymentProvider(String configName, String displayName) {
        this.configName = configName;
        this.displayName = displayName;
    }

    /**
     * 不分大小寫、忽略前後空白
     */
    public static Optional<PaymentProvider> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.configName.equals(normalized))
                .findFirst();
    }

    public static List<String> configNames() {
        return Arrays.stream(values()).map(PaymentProvider::getConfigName).toList();
    }
}

package com.ats.subscription.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 金流 webhook 事件（meta.event_name）
 */
public enum WebhookEvent {

    ORDER_CREATED("order_created"),
    ORDER_REFUNDED("order_refunded"),
    SUBSCRIPTION_CREATED("subscription_created"),
    SUBSCRIPTION_UPDATED("subscription_updated"),
    SUBSCRIPTION_CANCELLED("subscription_cancelled"),
    SUBSCRIPTION_RESUMED("subscription_resumed"),
    SUBSCRIPTION_EXPIRED("subscription_expired"),
    SUBSCRIPTION_PAUSED("subscription_paused"),
    SUBSCRIPTION_UNPAUSED("subscription_unpaused"),
    SUBSCRIPTION_PAYMENT_SUCCESS("subscription_payment_success"),
    SUBSCRIPTION_PAYMENT_FAILED("subscription_payment_failed"),
    SUBSCRIPTION_PAYMENT_RECOVERED("subscription_payment_recovered"),
    SUBSCRIPTION_PAYMENT_REFUNDED("subscription_payment_refunded"),
    SUBSCRIPTION_PLAN_CHANGED("subscription_plan_changed"),
    LICENSE_KEY_CREATED("license_key_created"),
    LICENSE_KEY_UPDATED("license_key_updated"),
    AFFILIATE_ACTIVATED("affiliate_activated");

    /** 建立或重新啟用訂閱 */
    public static final Set<WebhookEvent> ACTIVATION_EVENTS = EnumSet.of(
            SUBSCRIPTION_CREATED, SUBSCRIPTION_PAYMENT_SUCCESS,
            SUBSCRIPTION_RESUMED, SUBSCRIPTION_UNPAUSED);

    /** 停用訂閱 */
    public static final Set<WebhookEvent> DEACTIVATION_EVENTS = EnumSet.of(
            SUBSCRIPTION_CANCELLED, SUBSCRIPTION_EXPIRED, SUBSCRIPTION_PAUSED);

    private final String eventName;

    WebhookEvent(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static Optional<WebhookEvent> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(e -> e.eventName.equals(eventName))
                .findFirst();
    }

    public boolean isActivation() {
        return ACTIVATION_EVENTS.contains(this);
    }

    public boolean isDeactivation() {
        return DEACTIVATION_EVENTS.contains(this);
    }
}

package com.ats.notification.service;

import com.ats.shared.config.NotificationConfig;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 訂閱相關郵件通知
 *
 * 模板渲染與寄送由郵件中繼服務負責，這裡只送出「模板代碼 + 變數」。
 *
 * 特性：
 * - 非同步發送（enqueue），不阻塞 webhook 處理
 * - enabled=false、URL 為空或收件人為空時靜默跳過
 */
@Slf4j
@Service
public class EmailNotificationService {

    public static final String TEMPLATE_SUBSCRIPTION_ACTIVATED = "subscription-activated";
    public static final String TEMPLATE_SUBSCRIPTION_CANCELLED = "subscription-cancelled";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final OkHttpClient httpClient;
    private final NotificationConfig notificationConfig;
    private final Gson gson = new Gson();

    public EmailNotificationService(OkHttpClient httpClient, NotificationConfig notificationConfig) {
        this.httpClient = httpClient;
        this.notificationConfig = notificationConfig;
    }

    /**
     * 訂閱開通 / 恢復
     */
    public void sendSubscriptionActivated(String email, String name, String planName,
                                          BigDecimal amount, String currency, LocalDateTime endsAt) {
        send(email, TEMPLATE_SUBSCRIPTION_ACTIVATED, Map.of(
                "name", nullToEmpty(name),
                "planName", nullToEmpty(planName),
                "amount", amount != null ? amount.toPlainString() : "",
                "currency", nullToEmpty(currency),
                "renewsAt", endsAt != null ? endsAt.format(DATE_FMT) : ""));
    }

    /**
     * 訂閱取消
     */
    public void sendSubscriptionCancelled(String email, String name, String planName,
                                          LocalDateTime endsAt) {
        send(email, TEMPLATE_SUBSCRIPTION_CANCELLED, Map.of(
                "name", nullToEmpty(name),
                "planName", nullToEmpty(planName),
                "accessEndsAt", endsAt != null ? endsAt.format(DATE_FMT) : ""));
    }

    private void send(String to, String template, Map<String, String> variables) {
        if (!notificationConfig.isEnabled()) {
            return;
        }
        String url = notificationConfig.getUrl();
        if (url == null || url.isBlank() || to == null || to.isBlank()) {
            return;
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(buildBody(to, template, variables), JSON))
                .build();

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("郵件通知發送失敗: template={}, error={}", template, e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("郵件中繼回應異常: template={}, HTTP {}", template, response.code());
                    } else {
                        log.debug("郵件通知已送出: template={}", template);
                    }
                }
            }
        });
    }

    /**
     * {
     *   "from": "...", "to": "...", "template": "subscription-activated",
     *   "variables": { "name": "...", ... }
     * }
     */
    String buildBody(String to, String template, Map<String, String> variables) {
        JsonObject vars = new JsonObject();
        variables.forEach(vars::addProperty);

        JsonObject body = new JsonObject();
        body.addProperty("from", notificationConfig.getSender());
        body.addProperty("to", to);
        body.addProperty("template", template);
        body.add("variables", vars);
        return gson.toJson(body);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

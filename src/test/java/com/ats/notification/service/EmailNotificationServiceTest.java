package com.ats.notification.service;

import com.ats.shared.config.NotificationConfig;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * EmailNotificationService 單元測試
 *
 * 覆蓋：停用/未設定時跳過、非同步送出、body 格式
 */
class EmailNotificationServiceTest {

    private OkHttpClient httpClient;
    private Call mockCall;

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        mockCall = mock(Call.class);
        when(httpClient.newCall(any())).thenReturn(mockCall);
    }

    private EmailNotificationService service(boolean enabled, String url) {
        return new EmailNotificationService(httpClient, new NotificationConfig(url, enabled, "no-reply@ats.test"));
    }

    @Nested
    @DisplayName("跳過條件")
    class SkipTests {

        @Test
        @DisplayName("停用：不發請求")
        void disabled() {
            service(false, "https://mail.test/send")
                    .sendSubscriptionCancelled("a@b.com", "Ann", "Pro", LocalDateTime.now());

            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("未設定 url：不發請求")
        void noUrl() {
            service(true, "").sendSubscriptionCancelled("a@b.com", "Ann", "Pro", null);

            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("沒有收件人：不發請求")
        void noRecipient() {
            service(true, "https://mail.test/send").sendSubscriptionCancelled(null, "Ann", "Pro", null);

            verify(httpClient, never()).newCall(any());
        }
    }

    @Test
    @DisplayName("啟用時非同步送出（enqueue）")
    void sendsAsync() {
        service(true, "https://mail.test/send").sendSubscriptionActivated("a@b.com", "Ann", "Pro",
                new BigDecimal("19.99"), "USD", LocalDateTime.of(2024, 6, 1, 8, 0));

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(httpClient).newCall(captor.capture());
        assertThat(captor.getValue().url().toString()).isEqualTo("https://mail.test/send");
        verify(mockCall).enqueue(any(Callback.class));
    }

    @Test
    @DisplayName("body：from/to/template/variables")
    void bodyFormat() {
        String body = service(true, "https://mail.test/send").buildBody("a@b.com",
                EmailNotificationService.TEMPLATE_SUBSCRIPTION_ACTIVATED, Map.of("planName", "Pro"));

        JsonObject json = JsonParser.parseString(body).getAsJsonObject();
        assertThat(json.get("from").getAsString()).isEqualTo("no-reply@ats.test");
        assertThat(json.get("to").getAsString()).isEqualTo("a@b.com");
        assertThat(json.get("template").getAsString()).isEqualTo("subscription-activated");
        assertThat(json.getAsJsonObject("variables").get("planName").getAsString()).isEqualTo("Pro");
    }
}

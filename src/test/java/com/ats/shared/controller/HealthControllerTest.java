package com.ats.shared.controller;

import com.ats.payment.service.PaymentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * HealthController 單元測試
 *
 * 覆蓋：回報 UP 與供應商名稱，不觸發供應商連線檢查
 */
class HealthControllerTest {

    @Test
    @DisplayName("回報 UP 與目前的金流供應商，不呼叫 healthCheck")
    void reportsUpWithoutCallingProvider() {
        PaymentService paymentService = mock(PaymentService.class);
        when(paymentService.getProviderName()).thenReturn("lemonsqueezy");

        Map<String, String> body = new HealthController(paymentService).health().getBody();

        assertThat(body).containsEntry("status", "UP")
                .containsEntry("paymentProvider", "lemonsqueezy")
                .containsKey("time");
        verify(paymentService, never()).healthCheck();
    }
}

package com.ats.shared.controller;

import com.ats.payment.service.PaymentService;
import com.ats.shared.util.DateTimeUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 容器探活端點，公開存取
 *
 * 只回報本服務存活與目前設定的金流供應商名稱，不對供應商發出請求；
 * 供應商連線檢查在 /subscriptions/provider/health（管理員）。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final PaymentService paymentService;

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("paymentProvider", paymentService.getProviderName());
        body.put("time", DateTimeUtil.now().toString());
        return ResponseEntity.ok(body);
    }
}

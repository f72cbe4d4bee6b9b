package com.ats.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 建立結帳頁請求（供應商無關）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    /** 供應商的商品規格 ID（Lemon Squeezy variant） */
    private String variantId;

    private String customerEmail;
    private String customerName;

    /** 付款完成後導回的網址，null 時使用設定檔的 success-url */
    private String redirectUrl;

    /** 會在 webhook 中原樣帶回的自訂資料（user_id、plan_id 等） */
    private Map<String, String> customData;
}

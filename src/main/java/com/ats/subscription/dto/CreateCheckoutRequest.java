package com.ats.subscription.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateCheckoutRequest {

    @NotNull(message = "planId 不可為空")
    private Long planId;

    @Valid
    private Metadata metadata;

    @Data
    public static class Metadata {

        /** 預填在結帳頁的 email，未提供時由用戶在結帳頁輸入 */
        @Email(message = "email 格式錯誤")
        private String email;
    }
}

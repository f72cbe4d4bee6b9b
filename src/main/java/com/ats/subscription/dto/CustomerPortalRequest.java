package com.ats.subscription.dto;

import lombok.Data;

@Data
public class CustomerPortalRequest {

    /** 離開管理頁後導回的網址，可為空 */
    private String returnUrl;
}

package com.ats.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutResponse {

    private String checkoutUrl;
    private String checkoutId;

    /** 供應商名稱，例如 "LemonSqueezy" */
    private String provider;

    private LocalDateTime expiresAt;
}

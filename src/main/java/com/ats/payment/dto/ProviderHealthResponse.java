package com.ats.payment.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProviderHealthResponse {

    private String provider;

    /** healthy / unhealthy */
    private String status;

    private String message;
}

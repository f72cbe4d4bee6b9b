package com.ats.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelSubscriptionRequest {

    private String subscriptionId;

    /** true = 期滿後停止（預設）；false = 立即停止 */
    @Builder.Default
    private boolean cancelAtPeriodEnd = true;

    private String reason;
}

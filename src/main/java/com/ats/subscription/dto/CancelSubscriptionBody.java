package com.ats.subscription.dto;

import lombok.Data;

@Data
public class CancelSubscriptionBody {

    /** Lemon Squeezy 只支援期末取消，false 會被忽略 */
    private boolean cancelAtPeriodEnd = true;

    private String reason;
}

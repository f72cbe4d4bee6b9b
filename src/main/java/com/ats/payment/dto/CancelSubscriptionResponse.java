package com.ats.payment.dto;

import com.ats.payment.model.SubscriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelSubscriptionResponse {

    private String subscriptionId;
    private SubscriptionStatus status;
    private LocalDateTime cancelledAt;

    /** 服務實際停止時間（期滿取消時為當期結束） */
    private LocalDateTime endsAt;
}

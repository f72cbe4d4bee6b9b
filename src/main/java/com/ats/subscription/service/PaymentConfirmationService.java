package com.ats.subscription.service;

import com.ats.payment.service.PaymentService;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.subscription.dto.PaymentConfirmationResponse;
import com.ats.subscription.entity.PaymentLedgerEntry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 金流 webhook 處理流程
 *
 * 1. 先記帳（簽章驗證之前，確保每則通知都留有紀錄）
 * 2. 已處理過的通知直接回傳摘要（duplicate=true）
 * 3. 驗證簽章，失敗則標記帳本拒收（不消耗重試額度）並回 400
 * 4. 以驗證過的 body 更新帳本內容，之後只用驗證過的資料對帳
 * 5. 對帳（訂閱狀態轉移），失敗則標記帳本 FAILED 並往上拋
 * 6. 標記帳本已處理，狀態回到通知的付款狀態
 *
 * 帳本與訂閱各自提交，不包在同一個 transaction：
 * 對帳失敗時帳本的 FAILED 紀錄必須保留。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfirmationService {

    static final String INVALID_SIGNATURE_REASON = "invalid signature";

    private final PaymentLedgerService ledgerService;
    private final PaymentService paymentService;
    private final SubscriptionReconciliationService reconciliationService;

    /**
     * 處理一則 webhook 通知
     *
     * @param rawBody   原始 request body（簽章以此計算）
     * @param signature x-signature header，可為 null
     * @throws BadRequestException payload 格式錯誤、簽章不符，或無法對應訂閱用戶
     */
    public PaymentConfirmationResponse processWebhook(String rawBody, String signature) {
        PaymentLedgerEntry entry = ledgerService.recordNotification(rawBody);

        if (entry.isProcessed()) {
            log.info("重複的 webhook 通知，略過: ledgerId={}, externalPaymentId={}, event={}",
                    entry.getId(), entry.getExternalPaymentId(), entry.getEventName());
            return summary(entry, ReconciliationResult.ignored(), true);
        }
        if (entry.getStatus() == PaymentLedgerEntry.Status.FAILED && !entry.canRetry()) {
            log.warn("webhook 通知已達重試上限，略過: ledgerId={}, retryCount={}, lastError={}",
                    entry.getId(), entry.getRetryCount(), entry.getProcessingError());
            return summary(entry, ReconciliationResult.ignored(), true);
        }

        if (!paymentService.verifyWebhookSignature(signature, rawBody)) {
            ledgerService.markRejected(entry.getId(), INVALID_SIGNATURE_REASON);
            throw new BadRequestException(ErrorCode.INVALID_SIGNATURE, "Invalid webhook signature");
        }

        entry = ledgerService.refreshFromVerifiedPayload(entry, rawBody);
        String eventName = entry.getEventName();
        JsonNode payload = ledgerService.parsePayload(rawBody);
        ReconciliationResult result;
        try {
            result = reconciliationService.reconcile(eventName, payload, entry);
        } catch (RuntimeException e) {
            log.error("webhook 對帳失敗: ledgerId={}, event={}, error={}",
                    entry.getId(), eventName, e.getMessage());
            ledgerService.markFailed(entry.getId(), e.getMessage());
            throw e;
        }

        PaymentLedgerEntry processed = ledgerService.markProcessed(entry.getId());
        log.info("webhook 處理完成: ledgerId={}, event={}, outcome={}",
                processed.getId(), eventName, result.getOutcome());
        return summary(processed, result, false);
    }

    private static PaymentConfirmationResponse summary(PaymentLedgerEntry entry,
                                                       ReconciliationResult result,
                                                       boolean duplicate) {
        return PaymentConfirmationResponse.builder()
                .success(true)
                .message(PaymentConfirmationResponse.SUCCESS_MESSAGE)
                .eventName(entry.getEventName())
                .duplicate(duplicate)
                .subscriptionCreated(result.isCreated())
                .subscriptionUpdated(result.isUpdated())
                .paymentHistory(PaymentConfirmationResponse.PaymentHistory.from(entry))
                .subscription(PaymentConfirmationResponse.SubscriptionSummary.from(result.getSubscription()))
                .build();
    }
}

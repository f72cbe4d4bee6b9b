package com.ats.subscription.service;

import com.ats.shared.config.AppConstants;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.NotFoundException;
import com.ats.shared.util.DateTimeUtil;
import com.ats.subscription.dto.PaymentStatsResponse;
import com.ats.subscription.entity.PaymentLedgerEntry;
import com.ats.subscription.entity.SubscriptionPlan;
import com.ats.subscription.repository.PaymentLedgerRepository;
import com.ats.user.entity.User;
import com.ats.user.service.UserService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 金流通知帳本服務
 *
 * 負責：
 * 1. 冪等記錄供應商通知（同一 data.id 只寫一列）
 * 2. 解析 custom data、狀態、類型、金額，盡力連結用戶與方案
 * 3. 處理結果記帳（markProcessed / markFailed / markRejected）
 * 4. 付款紀錄查詢與統計
 *
 * 結構錯誤（缺 data.id / meta.event_name）直接拒絕；
 * 資料不完整（找不到用戶或方案）只記 warning，帳本照寫。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLedgerService {

    /** 供應商付款狀態 → 帳本狀態（key 為小寫） */
    static final Map<String, PaymentLedgerEntry.Status> STATUS_MAP = Map.of(
            "paid", PaymentLedgerEntry.Status.SUCCESS,
            "active", PaymentLedgerEntry.Status.SUCCESS,
            "cancelled", PaymentLedgerEntry.Status.CANCELLED,
            "expired", PaymentLedgerEntry.Status.EXPIRED,
            "failed", PaymentLedgerEntry.Status.FAILED,
            "refunded", PaymentLedgerEntry.Status.REFUNDED,
            "pending", PaymentLedgerEntry.Status.PENDING
    );

    /** 金額欄位（最小單位），依序取第一個非 null */
    static final List<String> AMOUNT_FIELDS = List.of("total", "subtotal", "total_usd");

    private final PaymentLedgerRepository ledgerRepository;
    private final CustomDataExtractor customDataExtractor;
    private final UserService userService;
    private final SubscriptionPlanService planService;
    private final ObjectMapper objectMapper;

    // ===================== 記錄通知 =====================

    /**
     * 冪等記錄一筆供應商通知
     *
     * 已存在相同 externalPaymentId 時原樣回傳既有那列，不做任何修改。
     * 並發寫入由 unique constraint 擋下，改為查詢後回傳。
     *
     * @param rawPayload 原始 request body
     * @throws BadRequestException payload 不是 JSON，或缺 data.id / meta.event_name
     */
    public PaymentLedgerEntry recordNotification(String rawPayload) {
        JsonNode payload = parsePayload(rawPayload);

        String externalPaymentId = requiredText(payload, "/data/id", "data.id");
        String eventName = requiredText(payload, "/meta/event_name", "meta.event_name");

        Optional<PaymentLedgerEntry> existing = ledgerRepository.findByExternalPaymentId(externalPaymentId);
        if (existing.isPresent()) {
            log.info("重複通知，回傳既有帳本: externalPaymentId={}, ledgerId={}, event={}",
                    externalPaymentId, existing.get().getId(), eventName);
            return existing.get();
        }

        PaymentLedgerEntry entry = fromPayload(payload, rawPayload);

        try {
            PaymentLedgerEntry saved = ledgerRepository.saveAndFlush(entry);
            log.info("帳本已記錄: ledgerId={}, externalPaymentId={}, event={}, status={}, amount={} {}, userId={}",
                    saved.getId(), externalPaymentId, eventName, saved.getStatus(),
                    saved.getAmount(), saved.getCurrency(), saved.getUserId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("並發重複通知，改為查詢既有帳本: externalPaymentId={}", externalPaymentId);
            return ledgerRepository.findByExternalPaymentId(externalPaymentId)
                    .orElseThrow(() -> e);
        }
    }

    /**
     * 簽章驗證通過後呼叫：既有帳本的 rawPayload 與驗證過的 body 不同時，
     * 以驗證過的內容重新解析並覆寫（用戶、方案、事件名稱等），避免沿用未驗證通知寫入的資料
     */
    @Transactional
    public PaymentLedgerEntry refreshFromVerifiedPayload(PaymentLedgerEntry entry, String rawPayload) {
        if (rawPayload.equals(entry.getRawPayload())) {
            return entry;
        }
        PaymentLedgerEntry verified = fromPayload(parsePayload(rawPayload), rawPayload);
        log.warn("帳本內容與驗證通過的通知不同，改用驗證後內容: ledgerId={}, externalPaymentId={}, "
                        + "storedUserId={}, verifiedUserId={}, event={}",
                entry.getId(), entry.getExternalPaymentId(), entry.getUserId(),
                verified.getUserId(), verified.getEventName());
        entry.replaceContent(verified);
        return ledgerRepository.save(entry);
    }

    /**
     * @throws BadRequestException 不是合法 JSON 物件
     */
    public JsonNode parsePayload(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new BadRequestException(ErrorCode.MALFORMED_PAYLOAD, "Webhook payload is empty");
        }
        try {
            JsonNode payload = objectMapper.readTree(rawPayload);
            if (payload == null || !payload.isObject()) {
                throw new BadRequestException(ErrorCode.MALFORMED_PAYLOAD, "Webhook payload must be a JSON object");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new BadRequestException(ErrorCode.MALFORMED_PAYLOAD, "Webhook payload is not valid JSON");
        }
    }

    // ===================== 處理結果 =====================

    @Transactional
    public PaymentLedgerEntry markProcessed(Long ledgerId) {
        PaymentLedgerEntry entry = getEntry(ledgerId);
        PaymentLedgerEntry.Status payloadStatus = entry.getRawPayload() != null
                ? payloadStatus(parsePayload(entry.getRawPayload()))
                : entry.getStatus();
        entry.markProcessed(payloadStatus, DateTimeUtil.now());
        log.info("帳本標記已處理: ledgerId={}, status={}, retryCount={}",
                ledgerId, payloadStatus, entry.getRetryCount());
        return ledgerRepository.save(entry);
    }

    @Transactional
    public PaymentLedgerEntry markFailed(Long ledgerId, String reason) {
        PaymentLedgerEntry entry = getEntry(ledgerId);
        entry.markFailed(reason, DateTimeUtil.now());
        log.warn("帳本標記失敗: ledgerId={}, reason={}, retryCount={}", ledgerId, reason, entry.getRetryCount());
        return ledgerRepository.save(entry);
    }

    /**
     * 簽章不符：標記 FAILED，不消耗重試額度
     */
    @Transactional
    public PaymentLedgerEntry markRejected(Long ledgerId, String reason) {
        PaymentLedgerEntry entry = getEntry(ledgerId);
        entry.markRejected(reason, DateTimeUtil.now());
        log.warn("帳本標記拒收: ledgerId={}, reason={}, retryCount={}", ledgerId, reason, entry.getRetryCount());
        return ledgerRepository.save(entry);
    }

    // ===================== 查詢方法 =====================

    public PaymentLedgerEntry getEntry(Long ledgerId) {
        return ledgerRepository.findById(ledgerId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LEDGER_ENTRY_NOT_FOUND,
                        "Ledger entry not found: " + ledgerId));
    }

    public Optional<PaymentLedgerEntry> findByExternalPaymentId(String externalPaymentId) {
        return ledgerRepository.findByExternalPaymentId(externalPaymentId);
    }

    public List<PaymentLedgerEntry> findByUserId(String userId) {
        return ledgerRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<PaymentLedgerEntry> findBySubscriptionPlanId(Long planId) {
        return ledgerRepository.findBySubscriptionPlanIdOrderByCreatedAtDesc(planId);
    }

    public PaymentStatsResponse getPaymentStats() {
        long total = ledgerRepository.count();
        long successful = ledgerRepository.countByStatus(PaymentLedgerEntry.Status.SUCCESS);
        long failed = ledgerRepository.countByStatus(PaymentLedgerEntry.Status.FAILED);
        BigDecimal revenue = ledgerRepository.sumLiveAmountByStatus(PaymentLedgerEntry.Status.SUCCESS);

        BigDecimal successRate = total == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(successful * 100L).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

        return PaymentStatsResponse.builder()
                .totalPayments(total)
                .successfulPayments(successful)
                .failedPayments(failed)
                .totalRevenue(revenue != null ? revenue.setScale(2, RoundingMode.HALF_UP) : BigDecimal.ZERO.setScale(2))
                .successRate(successRate)
                .build();
    }

    // ===================== 解析工具 =====================

    private PaymentLedgerEntry fromPayload(JsonNode payload, String rawPayload) {
        String externalPaymentId = requiredText(payload, "/data/id", "data.id");
        String eventName = requiredText(payload, "/meta/event_name", "meta.event_name");
        JsonNode attributes = payload.at("/data/attributes");
        JsonNode customData = customDataExtractor.extract(payload).orElse(null);

        return PaymentLedgerEntry.builder()
                .externalPaymentId(externalPaymentId)
                .eventName(eventName)
                .status(payloadStatus(payload))
                .paymentType(PaymentLedgerEntry.PaymentType.fromEventName(eventName))
                .amount(computeAmount(attributes))
                .currency(currency(attributes))
                .userId(resolveUserId(customData))
                .subscriptionPlanId(resolvePlanId(customData, payload))
                .rawPayload(rawPayload)
                .testMode(payload.at("/meta/test_mode").asBoolean(false))
                .customerEmail(textOrNull(attributes, "user_email") != null
                        ? textOrNull(attributes, "user_email")
                        : CustomDataExtractor.text(customData, "email").orElse(null))
                .metadata(buildMetadata(customData))
                .build();
    }

    private static PaymentLedgerEntry.Status payloadStatus(JsonNode payload) {
        return mapPaymentStatus(textOrNull(payload.at("/data/attributes"), "status"));
    }

    /**
     * 未知或缺少狀態一律視為 PENDING（記 warning，不拋例外）
     */
    public static PaymentLedgerEntry.Status mapPaymentStatus(String providerStatus) {
        if (providerStatus == null || providerStatus.isBlank()) {
            log.warn("通知未帶付款狀態，視為 PENDING");
            return PaymentLedgerEntry.Status.PENDING;
        }
        PaymentLedgerEntry.Status status = STATUS_MAP.get(providerStatus.trim().toLowerCase(Locale.ROOT));
        if (status == null) {
            log.warn("未知的付款狀態，視為 PENDING: {}", providerStatus);
            return PaymentLedgerEntry.Status.PENDING;
        }
        return status;
    }

    /**
     * 金額以最小單位傳入（cents），除以 100 後四捨五入到兩位小數；都沒有時為 0.00
     */
    public static BigDecimal computeAmount(JsonNode attributes) {
        for (String field : AMOUNT_FIELDS) {
            JsonNode node = attributes != null ? attributes.get(field) : null;
            if (node == null || node.isNull()) {
                continue;
            }
            try {
                BigDecimal minorUnits = node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
                return minorUnits.divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
            } catch (NumberFormatException e) {
                log.warn("金額欄位無法解析: field={}, value={}", field, node.asText());
            }
        }
        return BigDecimal.ZERO.setScale(2);
    }

    private static String currency(JsonNode attributes) {
        String currency = textOrNull(attributes, "currency");
        return currency != null ? currency.toUpperCase(Locale.ROOT) : AppConstants.DEFAULT_CURRENCY;
    }

    private String resolveUserId(JsonNode customData) {
        Optional<String> candidate = CustomDataExtractor.text(customData, "user_id", "userId");
        if (candidate.isEmpty()) {
            log.warn("custom data 未帶 user_id，帳本不連結用戶");
            return null;
        }
        Optional<String> userId = userService.findQuietly(candidate.get()).map(User::getUserId);
        if (userId.isEmpty()) {
            log.warn("custom data 的用戶不存在，帳本不連結用戶: userId={}", candidate.get());
        }
        return userId.orElse(null);
    }

    /**
     * 優先使用 custom data 的 plan_id，其次用訂單第一個品項的 variant_id 對應方案
     */
    private Long resolvePlanId(JsonNode customData, JsonNode payload) {
        Optional<String> candidate = CustomDataExtractor.text(customData, "plan_id", "planId", "subscription_plan_id");
        if (candidate.isPresent()) {
            try {
                Optional<SubscriptionPlan> plan = planService.findQuietly(Long.parseLong(candidate.get()));
                if (plan.isPresent()) {
                    return plan.get().getId();
                }
                log.warn("custom data 的方案不存在: planId={}", candidate.get());
            } catch (NumberFormatException e) {
                log.warn("custom data 的 plan_id 不是數字: {}", candidate.get());
            }
        }

        for (String pointer : List.of("/data/attributes/first_order_item/variant_id", "/data/attributes/variant_id")) {
            JsonNode variant = payload.at(pointer);
            if (variant.isMissingNode() || variant.isNull()) {
                continue;
            }
            Optional<SubscriptionPlan> plan = planService.findByVariantQuietly(variant.asText());
            if (plan.isPresent()) {
                return plan.get().getId();
            }
            log.warn("variant 無對應方案: variantId={}", variant.asText());
        }
        return null;
    }

    private String buildMetadata(JsonNode customData) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.set("customData", customData != null ? customData : objectMapper.createObjectNode());
        return metadata.toString();
    }

    private static String requiredText(JsonNode payload, String pointer, String fieldName) {
        JsonNode node = payload.at(pointer);
        if (node.isMissingNode() || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new BadRequestException(ErrorCode.MALFORMED_PAYLOAD, "Webhook payload is missing " + fieldName);
        }
        return node.asText().trim();
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}

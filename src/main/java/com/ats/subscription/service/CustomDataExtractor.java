package com.ats.subscription.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 從 webhook payload 取出結帳時帶入的 custom data（user_id / plan_id / email）
 *
 * 供應商在不同事件把 custom data 放在不同位置。依下列順序逐一探測（JSON Pointer），
 * 第一個解析成「非空物件」的位置勝出；順序代表權威性，不可任意調整。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomDataExtractor {

    /** 物件型位置，依序探測 */
    public static final List<String> CUSTOM_DATA_PATHS = List.of(
            "/data/attributes/custom_data",
            "/data/attributes/checkout_data/custom",
            "/data/attributes/checkout_data/custom_data",
            "/meta/custom_data",
            "/data/relationships/subscription/data/attributes/custom_data",
            "/data/attributes/first_order_item/custom_data",
            "/data/attributes/subscription/custom_data"
    );

    /** 最後手段：字串化的 JSON */
    public static final List<String> STRINGIFIED_CUSTOM_DATA_PATHS = List.of(
            "/data/attributes/custom_data_string",
            "/data/attributes/checkout_data/custom_string"
    );

    private final ObjectMapper objectMapper;

    /**
     * @return 第一個非空物件；都找不到時回傳 empty
     */
    public Optional<JsonNode> extract(JsonNode payload) {
        for (String path : CUSTOM_DATA_PATHS) {
            JsonNode node = payload.at(path);
            if (isNonEmptyObject(node)) {
                log.debug("custom data 來源: {}", path);
                return Optional.of(node);
            }
        }

        for (String path : STRINGIFIED_CUSTOM_DATA_PATHS) {
            JsonNode node = payload.at(path);
            if (!node.isTextual() || node.asText().isBlank()) {
                continue;
            }
            try {
                JsonNode parsed = objectMapper.readTree(node.asText());
                if (isNonEmptyObject(parsed)) {
                    log.debug("custom data 來源（字串）: {}", path);
                    return Optional.of(parsed);
                }
            } catch (Exception e) {
                log.warn("custom data 字串不是合法 JSON: path={}, error={}", path, e.getMessage());
            }
        }

        return Optional.empty();
    }

    /**
     * 依序取第一個非空的文字欄位
     */
    public static Optional<String> text(JsonNode customData, String... keys) {
        if (customData == null) {
            return Optional.empty();
        }
        for (String key : keys) {
            JsonNode value = customData.get(key);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return Optional.of(value.asText().trim());
            }
        }
        return Optional.empty();
    }

    private static boolean isNonEmptyObject(JsonNode node) {
        return node != null && node.isObject() && node.size() > 0;
    }
}

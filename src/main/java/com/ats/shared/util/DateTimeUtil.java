package com.ats.shared.util;

import com.ats.shared.config.AppConstants;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 供應商 ISO-8601 時間字串（例如 2024-05-01T08:00:00.000000Z）轉換成應用時區的 LocalDateTime
 */
public final class DateTimeUtil {

    private DateTimeUtil() {}

    /**
     * @return 無法解析或為空時回傳 null
     */
    public static LocalDateTime parseIso(String value) {
        if (value == null || value.isBlank() || "null".equals(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value)
                    .atZoneSameInstant(AppConstants.ZONE_ID)
                    .toLocalDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static LocalDateTime now() {
        return LocalDateTime.now(AppConstants.ZONE_ID);
    }
}

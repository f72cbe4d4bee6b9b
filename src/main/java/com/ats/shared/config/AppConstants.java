package com.ats.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * 全域應用常數
 *
 * Spring 啟動時讀取 application.yml 的 app.timezone，
 * 寫入 static 欄位供 Entity（@PrePersist）與帳本時間戳使用。
 */
@Component
public class AppConstants {

    /** 應用時區，供 LocalDateTime.now(ZONE_ID) 使用 */
    public static ZoneId ZONE_ID = ZoneId.of("Asia/Taipei");

    /** 未帶 currency 的金額一律視為美元 */
    public static final String DEFAULT_CURRENCY = "USD";

    @Value("${app.timezone:Asia/Taipei}")
    public void setTimezone(String tz) {
        ZONE_ID = ZoneId.of(tz);
    }
}

package com.ats.shared.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 簽名工具
 *
 * 金流 webhook 以共享密鑰對原始 request body 簽名，header 帶 hex 字串。
 */
public final class HmacSignatureUtil {

    private static final String ALGORITHM = "HmacSHA256";

    private HmacSignatureUtil() {}

    /**
     * 使用 HMAC SHA256 對資料簽名
     *
     * @param data   原始資料（webhook 原始 body）
     * @param secret 共享密鑰
     * @return 小寫 hex 字串
     */
    public static String sign(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (Exception e) {
            throw new IllegalStateException("HMAC 簽名失敗", e);
        }
    }

    /**
     * 驗證 hex 簽名（常數時間比對）
     *
     * @return signature 為空或不相符時回傳 false
     */
    public static boolean verify(String data, String secret, String signature) {
        if (signature == null || signature.isBlank() || data == null) {
            return false;
        }
        String expected = sign(data, secret);
        String provided = signature.trim().toLowerCase(Locale.ROOT);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}

package com.ats.shared.util;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

/**
 * HmacSignatureUtil 單元測試
 *
 * 覆蓋：已知向量、大小寫與空白、缺少簽名、body 被竄改
 */
class HmacSignatureUtilTest {

    private static final String SECRET = "whsec_test";
    private static final String BODY = "{\"meta\":{\"event_name\":\"order_created\"},\"data\":{\"id\":\"1\"}}";

    @Nested
    @DisplayName("簽名")
    class SignTests {

        @Test
        @DisplayName("RFC 4231 測試向量")
        void matchesKnownVector() {
            // RFC 4231 test case 2
            String signature = HmacSignatureUtil.sign("what do ya want for nothing?", "Jefe");

            assertThat(signature)
                    .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
        }

        @Test
        @DisplayName("輸出為 64 字元小寫 hex")
        void lowercaseHex() {
            assertThat(HmacSignatureUtil.sign(BODY, SECRET)).matches("[0-9a-f]{64}");
        }
    }

    @Nested
    @DisplayName("驗證")
    class VerifyTests {

        @Test
        @DisplayName("正確簽名通過")
        void validSignature() {
            String signature = HmacSignatureUtil.sign(BODY, SECRET);

            assertThat(HmacSignatureUtil.verify(BODY, SECRET, signature)).isTrue();
        }

        @Test
        @DisplayName("大寫與前後空白仍通過")
        void uppercaseAndWhitespace() {
            String signature = "  " + HmacSignatureUtil.sign(BODY, SECRET).toUpperCase() + "\n";

            assertThat(HmacSignatureUtil.verify(BODY, SECRET, signature)).isTrue();
        }

        @Test
        @DisplayName("缺少簽名視為不符")
        void missingSignature() {
            assertThat(HmacSignatureUtil.verify(BODY, SECRET, null)).isFalse();
            assertThat(HmacSignatureUtil.verify(BODY, SECRET, "  ")).isFalse();
        }

        @Test
        @DisplayName("body 被修改後不通過")
        void tamperedBody() {
            String signature = HmacSignatureUtil.sign(BODY, SECRET);

            assertThat(HmacSignatureUtil.verify(BODY.replace("1", "2"), SECRET, signature)).isFalse();
        }

        @Test
        @DisplayName("密鑰不同不通過")
        void wrongSecret() {
            String signature = HmacSignatureUtil.sign(BODY, "other-secret");

            assertThat(HmacSignatureUtil.verify(BODY, SECRET, signature)).isFalse();
        }
    }
}

package com.ats.auth.service;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * JWT Token 服務
 *
 * Token 由帳號服務簽發，本服務只負責驗證與解析。
 * 使用 HMAC-SHA256 簽名，jjwt 0.12.6。
 */
@Slf4j
@Service
public class JwtService {

    private final SecretKey signingKey;

    public JwtService(@Value("${jwt.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 驗證 Token 是否有效
     *
     * @return true = 簽名正確且未過期
     */
    public boolean validateToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        try {
            parseClaims(token);
            return true;
        } catch (ExpiredJwtException e) {
            log.warn("JWT 已過期: {}", e.getMessage());
        } catch (JwtException e) {
            log.warn("JWT 驗證失敗: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("JWT 格式錯誤: {}", e.getMessage());
        }
        return false;
    }

    /**
     * 從 Token 中提取 userId（subject claim）
     */
    public String extractUserId(String token) {
        return parseClaims(token).getSubject();
    }

    /**
     * 從 Token 中提取角色，未帶 role claim 時視為 USER
     */
    public String extractRole(String token) {
        String role = parseClaims(token).get("role", String.class);
        return role != null ? role : "USER";
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

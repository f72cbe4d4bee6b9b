package com.ats.auth.config;

import com.ats.auth.filter.JwtAuthenticationFilter;
import com.ats.auth.handler.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security 設定
 *
 * 路徑規則：
 * - /api/health → 公開
 * - POST /subscriptions/payment-confirmation → 公開（供應商 webhook，靠 HMAC 簽名驗證）
 * - GET /subscriptions/plans/** → 公開（方案目錄）
 * - /subscriptions/** 其餘 → 需要 JWT
 * - 其他 → 拒絕
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class AuthConfig {

    private final JwtAuthenticationFilter jwtAuthenticationFilter;
    private final CustomAuthenticationEntryPoint authenticationEntryPoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(exception -> exception
                        .authenticationEntryPoint(authenticationEntryPoint))
                .authorizeHttpRequests(auth -> auth
                        // === 公開端點 ===
                        .requestMatchers("/api/health").permitAll()
                        .requestMatchers(HttpMethod.POST, "/subscriptions/payment-confirmation").permitAll()
                        .requestMatchers(HttpMethod.GET, "/subscriptions/plans", "/subscriptions/plans/**").permitAll()

                        // === 受保護：需要 JWT ===
                        .requestMatchers("/subscriptions/**").authenticated()

                        // === 其他：全部拒絕 ===
                        .anyRequest().denyAll()
                )
                .addFilterBefore(jwtAuthenticationFilter,
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}

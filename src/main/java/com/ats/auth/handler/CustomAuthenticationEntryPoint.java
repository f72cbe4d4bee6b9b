package com.ats.auth.handler;

import com.ats.shared.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 自定義認證進入點
 *
 * 缺少或帶無效 JWT 時由 Spring Security 觸發，
 * 回傳統一的 JSON 401 而不是預設的 HTML 頁面。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException)
            throws IOException, ServletException {

        String authHeader = request.getHeader("Authorization");
        log.warn("認證失敗 [{}] Header={} Message={}",
                request.getRequestURI(),
                authHeader != null ? "present" : "missing",
                authException.getMessage());

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);

        ErrorResponse errorResponse = ErrorResponse.builder()
                .error("未授權 (401)")
                .message("請提供有效的 Bearer Token。格式: Authorization: Bearer {token}")
                .build();

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}

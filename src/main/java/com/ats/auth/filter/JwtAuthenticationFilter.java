package com.ats.auth.filter;

import com.ats.auth.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 訂閱 API 的 JWT 過濾器
 *
 * 結帳、取消、客戶入口與付款紀錄都以 token 內的 userId 判斷本人或管理員，
 * 這裡只負責把 userId / role 放進 SecurityContext；
 * token 缺少、無效或沒有角色時保持未認證，交給 CustomAuthenticationEntryPoint 回 401。
 *
 * 供應商 webhook 與探活端點不經過此過濾器。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    /** 不帶 JWT 的呼叫端：金流供應商、容器 health check */
    static final Set<String> UNFILTERED_PATHS = Set.of(
            "/subscriptions/payment-confirmation",
            "/api/health"
    );

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                     HttpServletResponse response,
                                     FilterChain filterChain)
            throws ServletException, IOException {

        resolveBearerToken(request).ifPresent(token -> authenticate(token, request));
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return UNFILTERED_PATHS.contains(request.getRequestURI());
    }

    private Optional<String> resolveBearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private void authenticate(String token, HttpServletRequest request) {
        try {
            if (!jwtService.validateToken(token)) {
                log.debug("JWT 無效，維持未認證: path={}", request.getRequestURI());
                return;
            }
            String userId = jwtService.extractUserId(token);
            String role = jwtService.extractRole(token);
            if (userId == null || role == null) {
                log.warn("JWT 缺少 userId 或 role，維持未認證: path={}", request.getRequestURI());
                return;
            }

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    userId, null, List.of(new SimpleGrantedAuthority("ROLE_" + role)));
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("JWT 認證成功: userId={}, role={}, path={}", userId, role, request.getRequestURI());
        } catch (RuntimeException e) {
            log.warn("JWT 處理失敗: path={}, error={}", request.getRequestURI(), e.getMessage());
        }
    }
}

package com.ats.shared.util;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * 安全工具類
 *
 * 從 SecurityContext 取得當前登入用戶的 ID 和角色。
 */
public final class SecurityUtil {

    private SecurityUtil() {
    }

    /**
     * 取得當前登入用戶的 userId
     *
     * @throws IllegalStateException 如果用戶未登入
     */
    public static String getCurrentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()
                || "anonymousUser".equals(auth.getPrincipal())) {
            throw new IllegalStateException("用戶未登入");
        }
        return (String) auth.getPrincipal();
    }

    /**
     * 取得當前登入用戶的角色（USER / ADMIN），未登入時回傳 null
     */
    public static String getCurrentUserRole() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return null;
        }
        return auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(a -> a.startsWith("ROLE_"))
                .map(a -> a.substring(5))
                .findFirst()
                .orElse("USER");
    }

    public static boolean isAdmin() {
        return "ADMIN".equals(getCurrentUserRole());
    }

    /**
     * 只允許本人或管理員存取該用戶的資料
     *
     * @throws AccessDeniedException 非本人且非管理員
     */
    public static void requireSelfOrAdmin(String userId) {
        if (!getCurrentUserId().equals(userId) && !isAdmin()) {
            throw new AccessDeniedException("無權存取其他用戶的資料");
        }
    }

    /**
     * @throws AccessDeniedException 非管理員
     */
    public static void requireAdmin() {
        if (!isAdmin()) {
            throw new AccessDeniedException("需要管理員權限");
        }
    }
}

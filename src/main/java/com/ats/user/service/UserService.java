package com.ats.user.service;

import com.ats.user.entity.User;
import com.ats.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 用戶查詢（帳號資料由帳號服務維護，這裡只讀）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    public Optional<User> findById(String userId) {
        return userRepository.findById(userId);
    }

    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    /**
     * 不拋例外的查詢：webhook 帶來的 userId 可能是任意字串，
     * 查不到或 DB 異常都回傳 empty，由呼叫端決定要不要降級。
     */
    public Optional<User> findQuietly(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        try {
            return userRepository.findById(userId);
        } catch (Exception e) {
            log.warn("查詢用戶失敗: userId={}, error={}", userId, e.getMessage());
            return Optional.empty();
        }
    }
}

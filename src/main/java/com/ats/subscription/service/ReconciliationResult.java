package com.ats.subscription.service;

import com.ats.subscription.entity.Subscription;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 單次對帳的結果
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconciliationResult {

    public enum Outcome {
        CREATED,   // 新建訂閱
        UPDATED,   // 既有訂閱狀態變更
        IGNORED    // 事件與訂閱無關，或找不到對應訂閱
    }

    private final Outcome outcome;

    /** IGNORED 時為 null */
    private final Subscription subscription;

    public static ReconciliationResult created(Subscription subscription) {
        return new ReconciliationResult(Outcome.CREATED, subscription);
    }

    public static ReconciliationResult updated(Subscription subscription) {
        return new ReconciliationResult(Outcome.UPDATED, subscription);
    }

    public static ReconciliationResult ignored() {
        return new ReconciliationResult(Outcome.IGNORED, null);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }

    public boolean isUpdated() {
        return outcome == Outcome.UPDATED;
    }
}

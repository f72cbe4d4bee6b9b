package com.ats.subscription.repository;

import com.ats.subscription.entity.PaymentLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentLedgerRepository extends JpaRepository<PaymentLedgerEntry, Long> {

    Optional<PaymentLedgerEntry> findByExternalPaymentId(String externalPaymentId);

    List<PaymentLedgerEntry> findByUserIdOrderByCreatedAtDesc(String userId);

    List<PaymentLedgerEntry> findBySubscriptionPlanIdOrderByCreatedAtDesc(Long subscriptionPlanId);

    long countByStatus(PaymentLedgerEntry.Status status);

    /** 沒有任何符合的資料時回傳 null */
    @Query("SELECT SUM(p.amount) FROM PaymentLedgerEntry p WHERE p.status = :status AND p.testMode = false")
    BigDecimal sumLiveAmountByStatus(PaymentLedgerEntry.Status status);
}

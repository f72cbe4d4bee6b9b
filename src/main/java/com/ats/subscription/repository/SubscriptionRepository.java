package com.ats.subscription.repository;

import com.ats.subscription.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    List<Subscription> findByUserIdOrderByCreatedAtDesc(String userId);

    @Query("SELECT s FROM Subscription s WHERE s.userId = :userId AND s.active = true AND s.cancelled = false ORDER BY s.createdAt DESC")
    List<Subscription> findActiveByUserId(String userId);

    boolean existsByUserIdAndActiveTrueAndCancelledFalse(String userId);

    Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId);

    long countByUserId(String userId);
}

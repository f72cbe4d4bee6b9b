package com.ats.subscription.repository;

import com.ats.subscription.entity.SubscriptionPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, Long> {

    List<SubscriptionPlan> findByActiveTrueOrderByPriceAsc();

    Optional<SubscriptionPlan> findByExternalVariantId(String externalVariantId);
}

package com.truefi.backend.repositories;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.RecurringIncome;

import jakarta.persistence.LockModeType;

@Repository
public interface RecurringIncomeRepository extends JpaRepository<RecurringIncome, UUID> {

    @Query("""
            select r from RecurringIncome r
            where r.userId = :userId
              and r.state = com.truefi.backend.enums.IncomeRecordState.CONFIRMED
              and (r.effectiveTo is null or r.effectiveTo > :now)
            order by r.effectiveFrom desc
            """)
    List<RecurringIncome> findActive(@Param("userId") UUID userId, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select r from RecurringIncome r
            where r.userId = :userId
              and r.state = com.truefi.backend.enums.IncomeRecordState.CONFIRMED
              and (r.effectiveTo is null or r.effectiveTo > :now)
            """)
    List<RecurringIncome> findActiveForUpdate(@Param("userId") UUID userId, @Param("now") Instant now);

    List<RecurringIncome> findByUserIdOrderByEffectiveFromDesc(UUID userId);
}

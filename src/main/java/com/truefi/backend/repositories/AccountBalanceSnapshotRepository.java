package com.truefi.backend.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.AccountBalanceSnapshot;

@Repository
public interface AccountBalanceSnapshotRepository extends JpaRepository<AccountBalanceSnapshot, UUID> {

    List<AccountBalanceSnapshot> findByAccountIdAndCapturedOnGreaterThanEqualOrderByCapturedOnAsc(UUID accountId, LocalDate from);
}

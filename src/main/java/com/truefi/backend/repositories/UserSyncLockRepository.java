package com.truefi.backend.repositories;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.UserSyncLock;

import jakarta.persistence.LockModeType;

@Repository
public interface UserSyncLockRepository extends JpaRepository<UserSyncLock, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from UserSyncLock l where l.userId = :userId")
    Optional<UserSyncLock> findForUpdate(@Param("userId") UUID userId);
}

package com.truefi.backend.entities;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row per user, locked FOR UPDATE to serialize that user's income and goal writes. */
@Entity
@Table(name = "user_sync_locks")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserSyncLock {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(nullable = false)
    private Instant createdAt;
}

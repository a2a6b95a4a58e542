package com.truefi.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.GoalNotification;

@Repository
public interface GoalNotificationRepository extends JpaRepository<GoalNotification, UUID> {

    List<GoalNotification> findTop50ByUserIdOrderByCreatedAtDesc(UUID userId);
}

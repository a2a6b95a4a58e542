package com.truefi.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.truefi.backend.entities.GoalAccountLink;

@Repository
public interface GoalAccountLinkRepository extends JpaRepository<GoalAccountLink, UUID> {

    @Query("""
            select l from GoalAccountLink l
            join fetch l.account a
            where l.goal.id = :goalId and a.active = true
            """)
    List<GoalAccountLink> findActiveByGoalId(@Param("goalId") UUID goalId);
}

package com.example.deal_bot.repo;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.deal_bot.entity.StateTransition;

@Repository
public interface StateTransitionRepository extends JpaRepository<StateTransition, Long> {

    @Query("""
            SELECT s FROM StateTransition s
            WHERE s.entityType = :entityType
            ORDER BY s.createdAt DESC
            """)
    List<StateTransition> findRecentByEntityType(
            @Param("entityType") String entityType,
            Pageable pageable
    );

    long countByEntityTypeAndToStateAndCreatedAtAfter(String entityType, String toState, LocalDateTime since);
}

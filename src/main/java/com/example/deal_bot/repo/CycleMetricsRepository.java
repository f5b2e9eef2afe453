package com.example.deal_bot.repo;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.deal_bot.entity.CycleMetrics;

@Repository
public interface CycleMetricsRepository extends JpaRepository<CycleMetrics, Long> {

    List<CycleMetrics> findByStartedAtGreaterThanEqualOrderByStartedAtAsc(Instant since);

    List<CycleMetrics> findAllByOrderByStartedAtDesc(Pageable pageable);
}

package com.example.deal_bot.repo;

import java.time.Instant;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.deal_bot.entity.DealRecord;

@Repository
public interface DealRecordRepository extends JpaRepository<DealRecord, Long> {

    Optional<DealRecord> findFirstByProductIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(
            String productId, Instant since);
}

package com.example.deal_bot.repo;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.deal_bot.entity.PostRecord;

@Repository
public interface PostRecordRepository extends JpaRepository<PostRecord, Long> {
}

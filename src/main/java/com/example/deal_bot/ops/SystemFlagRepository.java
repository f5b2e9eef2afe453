package com.example.deal_bot.ops;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SystemFlagRepository extends JpaRepository<SystemFlag, String> {
}

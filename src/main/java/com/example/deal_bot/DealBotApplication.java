package com.example.deal_bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class DealBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(DealBotApplication.class, args);
    }
}

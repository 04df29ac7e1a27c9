package com.studyspots;

import com.studyspots.config.StudySpotsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.retry.annotation.EnableRetry;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@EnableConfigurationProperties(StudySpotsProperties.class)
@EnableCaching
@EnableRetry
@Slf4j
public class StudySpotsApplication {
    public static void main(String[] args) {
        SpringApplication.run(StudySpotsApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("Study Spots API is shutting down. Closing database connection...");
    }
}

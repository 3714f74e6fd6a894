package com.db.ecd.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class AssessmentQueueApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssessmentQueueApplication.class, args);
    }
}

package com.whereq.arbiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Arbiter.
 * This service selects CI runners for jobs by capability constraints and learns
 * from job outcomes which feasible runner performs best.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ArbiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbiterApplication.class, args);
    }
}

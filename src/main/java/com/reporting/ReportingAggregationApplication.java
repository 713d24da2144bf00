package com.reporting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reporting Aggregation Backend
 *
 * Rule-based aggregation engine behind a small REST API:
 * - Synchronous aggregation with per-rule failure isolation
 * - Asynchronous aggregation jobs on a bounded worker pool
 * - Shared registry of versioned rule sets (schemas)
 *
 * Everything is held in memory; jobs do not survive a restart.
 */
@SpringBootApplication
@EnableScheduling
public class ReportingAggregationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportingAggregationApplication.class, args);
    }
}

package com.simdash.dashboard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the live simulation dashboard pipeline.
 *
 * This application ingests variable-change events from a running simulation
 * and turns them into bounded, summarized, render-ready time series.
 */
@Slf4j
@SpringBootApplication
public class LiveDashboardApplication {

    public static void main(String[] args) {
        log.info("Starting Live Dashboard Application...");
        SpringApplication.run(LiveDashboardApplication.class, args);
        log.info("Live Dashboard Application started successfully");
    }
}

package com.healthmonitor.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Integration Health Monitor.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.healthmonitor.api",
    "com.healthmonitor.engine"
})
public class MonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonitorApplication.class, args);
    }
}

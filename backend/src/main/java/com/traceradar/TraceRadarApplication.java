package com.traceradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraceRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceRadarApplication.class, args);
    }
}

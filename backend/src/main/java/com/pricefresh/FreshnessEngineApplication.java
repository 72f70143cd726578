package com.pricefresh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FreshnessEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreshnessEngineApplication.class, args);
    }
}

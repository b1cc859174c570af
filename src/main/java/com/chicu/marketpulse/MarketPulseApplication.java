package com.chicu.marketpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.marketpulse")
public class MarketPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketPulseApplication.class, args);
    }
}

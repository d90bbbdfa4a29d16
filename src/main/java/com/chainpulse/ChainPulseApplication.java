package com.chainpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainPulseApplication.class, args);
    }
}

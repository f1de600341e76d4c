package com.lynkvertx.vzev;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * vZEV - solar allocation and member billing engine for energy collectives
 * Main application entry point
 */
@SpringBootApplication
public class VzevApplication {

    public static void main(String[] args) {
        SpringApplication.run(VzevApplication.class, args);
    }
}

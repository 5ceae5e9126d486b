package com.purchasingpower.thesugraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThesuGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThesuGraphApplication.class, args);
    }
}

package com.tenacy.aiops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiopsDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiopsDetectorApplication.class, args);
    }
}

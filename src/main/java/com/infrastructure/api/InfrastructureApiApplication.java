package com.infrastructure.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfrastructureApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfrastructureApiApplication.class, args);
    }
}

package com.intelplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntelOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntelOrchestratorApplication.class, args);
    }
}

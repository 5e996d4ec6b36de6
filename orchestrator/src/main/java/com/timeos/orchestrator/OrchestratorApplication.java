package com.timeos.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Time OS cycle orchestrator.
 *
 * Runs collect → truth → snapshot → notify → maintenance unattended, one
 * cycle at a time, and serves read-only health and cycle history.
 *
 * To run against a local PostgreSQL:
 *   SPRING_DATASOURCE_URL=jdbc:postgresql://localhost:5432/timeos mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}

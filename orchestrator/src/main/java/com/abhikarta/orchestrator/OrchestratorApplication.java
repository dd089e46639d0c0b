package com.abhikarta.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Abhikarta workflow orchestrator.
 *
 * To run:
 *   DB_URL=jdbc:postgresql://localhost:5432/abhikarta ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run
 *
 * Without an API key the planner is unavailable and every plan falls back
 * to a single echo step, which is enough to exercise the approval flow.
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}

package com.marco.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Marco: turns natural-language commands into module actions.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... MARCO_FS_ROOT=~/work mvn spring-boot:run
 */
@SpringBootApplication
@EnableScheduling
public class MarcoApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarcoApplication.class, args);
    }
}

package com.dcruver.cultivation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the cultivation engine.
 *
 * Hosts the progression core of a turn-based cultivation game: character state,
 * action resolution, numeric rules and session life-cycle. Rendering and input
 * live in a separate front end that talks to {@code SessionManager}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class CultivationEngineApplication {

    public static void main(String[] args) {
        log.info("Starting Cultivation Engine...");
        SpringApplication.run(CultivationEngineApplication.class, args);
    }
}

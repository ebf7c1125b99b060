package com.dcruver.cultivation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Infrastructure beans for the engine: time source for log timestamps and
 * random source for talent rolls.
 */
@Configuration
@Slf4j
public class EngineConfiguration {

    /**
     * Optional fixed seed; when unset every run rolls different talents.
     */
    @Value("${cultivation.random-seed:#{null}}")
    private Long randomSeed;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator talentRandom() {
        if (randomSeed != null) {
            log.info("Using seeded random source for talent rolls (seed: {})", randomSeed);
            return new SplittableRandom(randomSeed);
        }
        return new SplittableRandom();
    }
}

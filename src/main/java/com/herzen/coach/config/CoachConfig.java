package com.herzen.coach.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
public class CoachConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random templateRandom(CoachProperties properties) {
        Long seed = properties.generator().seed();
        return seed == null ? new Random() : new Random(seed);
    }
}

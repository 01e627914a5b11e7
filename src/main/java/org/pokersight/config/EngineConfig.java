package org.pokersight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class EngineConfig {

    /** Sampling source for the equity engine. A fixed {@code poker.equity.seed} makes runs reproducible. */
    @Bean
    public Random equityRandom(@Value("${poker.equity.seed:}") String seed) {
        if (seed == null || seed.isBlank()) return new SecureRandom();
        return new Random(Long.parseLong(seed.strip()));
    }
}

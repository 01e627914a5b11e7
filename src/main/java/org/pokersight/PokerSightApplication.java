package org.pokersight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // idle session sweep
public class PokerSightApplication {
    public static void main(String[] args) {
        SpringApplication.run(PokerSightApplication.class, args);
    }
}

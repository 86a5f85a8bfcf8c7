package com.nosota.traitmarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TraitMarketApplication {
    public static void main(String[] args) {
        SpringApplication.run(TraitMarketApplication.class, args);
    }
}

package com.ecoWasteEngine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WasteEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WasteEngineApplication.class, args);
    }

}

package com.wakeengine.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WakeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WakeEngineApplication.class, args);
    }
}

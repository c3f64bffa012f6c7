package com.mead.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeadAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeadAssistantApplication.class, args);
    }
}

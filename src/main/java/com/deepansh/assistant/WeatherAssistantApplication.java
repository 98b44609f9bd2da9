package com.deepansh.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WeatherAssistantApplication {
    public static void main(String[] args) {
        SpringApplication.run(WeatherAssistantApplication.class, args);
    }
}

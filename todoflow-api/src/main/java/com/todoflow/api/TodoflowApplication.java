package com.todoflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application entry point for todoflow.
 */
@SpringBootApplication
@EnableConfigurationProperties(TodoflowProperties.class)
public class TodoflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(TodoflowApplication.class, args);
    }
}

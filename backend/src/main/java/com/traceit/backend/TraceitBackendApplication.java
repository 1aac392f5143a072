package com.traceit.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TraceitBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceitBackendApplication.class, args);
    }
}

package com.loom.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoomBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoomBackendApplication.class, args);
    }
}

package com.dropmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DropMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DropMatchApplication.class, args);
    }
}

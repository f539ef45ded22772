package com.seequence.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SeequenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeequenceApplication.class, args);
    }
}

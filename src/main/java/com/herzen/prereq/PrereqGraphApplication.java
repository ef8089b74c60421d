package com.herzen.prereq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PrereqGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrereqGraphApplication.class, args);
    }
}

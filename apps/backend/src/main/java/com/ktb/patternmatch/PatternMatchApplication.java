package com.ktb.patternmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PatternMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternMatchApplication.class, args);
    }
}

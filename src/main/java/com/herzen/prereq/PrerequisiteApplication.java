package com.herzen.prereq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrerequisiteApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrerequisiteApplication.class, args);
    }
}

package com.geico.poc.policyjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PolicyJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyJobsApplication.class, args);
    }
}

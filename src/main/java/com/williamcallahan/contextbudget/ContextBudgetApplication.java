package com.williamcallahan.contextbudget;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextBudgetApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextBudgetApplication.class, args);
    }

}

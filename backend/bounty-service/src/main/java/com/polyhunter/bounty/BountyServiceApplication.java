package com.polyhunter.bounty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BountyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BountyServiceApplication.class, args);
    }
}

package com.demandengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DemandEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemandEngineApplication.class, args);
    }
}

package com.satfetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.satfetch")
public class SatFetchApplication {
    public static void main(String[] args) {
        SpringApplication.run(SatFetchApplication.class, args);
    }
}

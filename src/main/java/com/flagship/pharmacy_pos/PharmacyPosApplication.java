package com.flagship.pharmacy_pos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PharmacyPosApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmacyPosApplication.class, args);
    }
}

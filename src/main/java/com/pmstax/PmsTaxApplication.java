package com.pmstax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PmsTaxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PmsTaxApplication.class, args);
    }
}

package com.washdispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WashDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WashDispatchApplication.class, args);
    }
}

package com.ureca.mimus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MimusApplication {

    public static void main(String[] args) {
        SpringApplication.run(MimusApplication.class, args);
    }
}

package com.syntaxprime.elephant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ElephantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ElephantApplication.class, args);
    }
}

package com.flagship.number_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class NumberGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(NumberGatewayApplication.class, args);
    }
}

package com.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CapabilityBridgeApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CapabilityBridgeApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

}

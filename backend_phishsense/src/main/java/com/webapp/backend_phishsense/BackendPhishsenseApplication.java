package com.webapp.backend_phishsense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackendPhishsenseApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendPhishsenseApplication.class, args);
    }
}

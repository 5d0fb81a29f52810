package com.example.FolioAgent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FolioAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FolioAgentApplication.class, args);
    }
}

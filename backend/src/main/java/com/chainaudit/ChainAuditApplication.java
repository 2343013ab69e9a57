package com.chainaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChainAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainAuditApplication.class, args);
    }
}

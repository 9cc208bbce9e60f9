package com.scanops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScanOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanOpsApplication.class, args);
    }
}

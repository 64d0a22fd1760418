package com.contractradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContractRadarApplication.class, args);
    }
}

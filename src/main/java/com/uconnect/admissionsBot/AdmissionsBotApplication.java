package com.uconnect.admissionsBot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdmissionsBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionsBotApplication.class, args);
    }
}

package com.dealplatform.negotiation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.dealplatform")
public class NegotiationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NegotiationServiceApplication.class, args);
    }
}

package com.trust.reputation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustGraphApplication.class, args);
    }
}

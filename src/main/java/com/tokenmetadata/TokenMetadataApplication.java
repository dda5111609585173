package com.tokenmetadata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TokenMetadataApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenMetadataApplication.class, args);
    }
}

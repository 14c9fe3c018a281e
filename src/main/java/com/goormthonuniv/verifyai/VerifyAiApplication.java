package com.goormthonuniv.verifyai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VerifyAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerifyAiApplication.class, args);
    }
}

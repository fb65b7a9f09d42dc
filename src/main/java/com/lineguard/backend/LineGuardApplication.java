package com.lineguard.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LineGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineGuardApplication.class, args);
    }
}

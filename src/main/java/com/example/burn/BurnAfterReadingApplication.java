package com.example.burn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BurnAfterReadingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BurnAfterReadingApplication.class, args);
    }
}

package com.example.signalrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class SignalRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalRagApplication.class, args);
    }
}

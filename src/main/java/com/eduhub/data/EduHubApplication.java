package com.eduhub.data;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EduHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(EduHubApplication.class, args);
    }
}

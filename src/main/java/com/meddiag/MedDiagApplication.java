package com.meddiag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MedDiagApplication {
    public static void main(String[] args) {
        SpringApplication.run(MedDiagApplication.class, args);
    }
}

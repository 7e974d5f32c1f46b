package com.admissioncontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdmissionControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionControlApplication.class, args);
    }
}

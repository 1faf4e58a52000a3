package com.pep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PepRehabApplication {

    public static void main(String[] args) {
        SpringApplication.run(PepRehabApplication.class, args);
    }
}

package com.chairman.salon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChairmanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChairmanApplication.class, args);
    }
}

package com.vidfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidfeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(VidfeedApplication.class, args);
    }
}

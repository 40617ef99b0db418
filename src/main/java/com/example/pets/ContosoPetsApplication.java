package com.example.pets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContosoPetsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContosoPetsApplication.class, args);
    }

}

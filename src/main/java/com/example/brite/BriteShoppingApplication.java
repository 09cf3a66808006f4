package com.example.brite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BriteShoppingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BriteShoppingApplication.class, args);
    }
}

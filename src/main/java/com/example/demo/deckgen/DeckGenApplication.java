package com.example.demo.deckgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeckGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckGenApplication.class, args);
    }
}

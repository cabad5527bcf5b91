package com.cashcow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CashcowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashcowApplication.class, args);
    }
}

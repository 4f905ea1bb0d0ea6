package com.flagship.transaction_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransactionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionEngineApplication.class, args);
    }
}

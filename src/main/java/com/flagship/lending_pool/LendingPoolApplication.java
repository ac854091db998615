package com.flagship.lending_pool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendingPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingPoolApplication.class, args);
    }
}

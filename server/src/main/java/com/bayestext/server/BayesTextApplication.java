package com.bayestext.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BayesTextApplication {

    public static void main(String[] args) {
        SpringApplication.run(BayesTextApplication.class, args);
    }
}

package com.sgbc.sgbcPrj;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SgbcApplication {

    public static void main(String[] args) {
        SpringApplication.run(SgbcApplication.class, args);
    }
}

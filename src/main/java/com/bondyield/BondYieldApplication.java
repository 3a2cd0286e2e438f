package com.bondyield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BondYieldApplication {

    public static void main(String[] args) {
        SpringApplication.run(BondYieldApplication.class, args);
    }
}

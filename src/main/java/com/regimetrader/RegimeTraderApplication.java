package com.regimetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegimeTraderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(RegimeTraderApplication.class, args)));
    }
}

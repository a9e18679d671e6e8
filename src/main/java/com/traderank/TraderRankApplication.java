package com.traderank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraderRankApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraderRankApplication.class, args);
    }
}

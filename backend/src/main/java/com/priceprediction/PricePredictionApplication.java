package com.priceprediction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PricePredictionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PricePredictionApplication.class, args);
    }
}

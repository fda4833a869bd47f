package com.farepredict;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FarePredictionApplication {

    public static void main(String[] args) {
        SpringApplication.run(FarePredictionApplication.class, args);
    }
}

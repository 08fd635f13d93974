package com.geoshard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeoshardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoshardApplication.class, args);
    }
}

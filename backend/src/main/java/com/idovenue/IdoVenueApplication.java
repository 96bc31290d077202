package com.idovenue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdoVenueApplication {
    public static void main(String[] args) {
        SpringApplication.run(IdoVenueApplication.class, args);
    }
}

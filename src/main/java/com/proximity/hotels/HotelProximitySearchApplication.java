package com.proximity.hotels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HotelProximitySearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotelProximitySearchApplication.class, args);
    }
}

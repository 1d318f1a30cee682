package com.lanparty.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StationBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(StationBookingApplication.class, args);
    }
}

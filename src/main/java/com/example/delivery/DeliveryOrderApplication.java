package com.example.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Delivery Order Service.
 */
@SpringBootApplication
public class DeliveryOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliveryOrderApplication.class, args);
    }
}

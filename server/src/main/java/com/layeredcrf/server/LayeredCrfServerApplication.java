package com.layeredcrf.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LayeredCrfServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayeredCrfServerApplication.class, args);
    }
}

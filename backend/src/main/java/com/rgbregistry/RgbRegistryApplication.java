package com.rgbregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RgbRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RgbRegistryApplication.class, args);
    }
}

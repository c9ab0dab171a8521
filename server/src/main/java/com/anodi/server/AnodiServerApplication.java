package com.anodi.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnodiServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnodiServerApplication.class, args);
    }
}

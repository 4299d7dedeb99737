package com.edgehistogram.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EhdServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EhdServerApplication.class, args);
    }
}

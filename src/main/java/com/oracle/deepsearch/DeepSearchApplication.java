package com.oracle.deepsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class DeepSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeepSearchApplication.class, args);
    }
}

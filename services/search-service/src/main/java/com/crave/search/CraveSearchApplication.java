package com.crave.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CraveSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(CraveSearchApplication.class, args);
    }
}

package com.naturalsql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NaturalSqlApplication {
    public static void main(String[] args) {
        SpringApplication.run(NaturalSqlApplication.class, args);
    }
}

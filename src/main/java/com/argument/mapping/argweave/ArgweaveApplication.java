package com.argument.mapping.argweave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArgweaveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArgweaveApplication.class, args);
    }
}

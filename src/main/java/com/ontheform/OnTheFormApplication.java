package com.ontheform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OnTheFormApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnTheFormApplication.class, args);
    }
}

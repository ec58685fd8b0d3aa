package com.example.villages;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VillagesApplication {

    public static void main(String[] args) {
        SpringApplication.run(VillagesApplication.class, args);
    }

}

package com.csd.kspcompat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KspCompatApplication {

    public static void main(String[] args) {
        SpringApplication.run(KspCompatApplication.class, args);
    }
}

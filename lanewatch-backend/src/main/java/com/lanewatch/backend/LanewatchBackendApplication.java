package com.lanewatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LanewatchBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LanewatchBackendApplication.class, args);
    }
}

package com.mythos.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MythosApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MythosApiApplication.class, args);
    }
}

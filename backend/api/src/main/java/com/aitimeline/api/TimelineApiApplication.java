package com.aitimeline.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class TimelineApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimelineApiApplication.class, args);
    }
}

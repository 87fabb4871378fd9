package com.programmersdiary.moltby;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MoltbyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MoltbyApplication.class, args);
    }
}

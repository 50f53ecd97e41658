package com.architecture.memory.flowgrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowgradeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowgradeApplication.class, args);
    }
}

package com.linlay.agentsview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentsViewApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentsViewApplication.class, args);
    }
}

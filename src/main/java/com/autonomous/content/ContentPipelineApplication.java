package com.autonomous.content;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentPipelineApplication.class, args);
    }
}

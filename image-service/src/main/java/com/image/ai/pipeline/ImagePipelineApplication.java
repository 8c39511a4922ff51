package com.image.ai.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImagePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImagePipelineApplication.class, args);
    }
}

package org.example.biolearn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BiologyLearningApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiologyLearningApplication.class, args);
    }
}

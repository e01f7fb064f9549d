package com.deepansh.learnermemory;

import com.deepansh.learnermemory.config.MemoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MemoryProperties.class)
public class LearnerMemoryApplication {
    public static void main(String[] args) {
        SpringApplication.run(LearnerMemoryApplication.class, args);
    }
}

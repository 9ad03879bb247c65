package com.deepansh.recall;

import com.deepansh.recall.config.MemoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties(MemoryProperties.class)
public class RecallApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }
}

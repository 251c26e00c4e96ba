package com.tennis.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.tennis.api.config.TennisDataProperties;

@SpringBootApplication
@EnableConfigurationProperties(TennisDataProperties.class)
public class TennisDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(TennisDataApplication.class, args);
    }
}
